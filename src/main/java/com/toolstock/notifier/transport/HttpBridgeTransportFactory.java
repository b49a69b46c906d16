package com.toolstock.notifier.transport;

import com.toolstock.notifier.config.NotifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link HttpBridgeTransport} instances from the application config.
 * One fresh transport per session; the reconnection path calls {@link #create()} again.
 */
public final class HttpBridgeTransportFactory implements ChatTransportFactory {

    private static final Logger LOG = LoggerFactory.getLogger(HttpBridgeTransportFactory.class);

    private final NotifierConfig config;

    public HttpBridgeTransportFactory(final NotifierConfig config) {
        this.config = config;
    }

    /** Returns {@code true} if a bridge URL and session name are configured. Called at startup to fail fast. */
    public boolean isConfigured() {
        return !config.getBridgeBaseUrl().isBlank() && !config.getBridgeSession().isBlank();
    }

    @Override
    public ChatTransport create() {
        LOG.info("Creating bridge transport: url={} session={} apiKey={}",
                config.getBridgeBaseUrl(), config.getBridgeSession(),
                config.getBridgeApiKey().isBlank() ? "absent" : "present");
        return new HttpBridgeTransport(
                config.getBridgeBaseUrl(),
                config.getBridgeSession(),
                config.getBridgeApiKey(),
                config.getBridgeConnectTimeout(),
                config.getBridgeReadTimeout());
    }
}
