package com.toolstock.notifier.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/** Writes operator alerts to a dedicated {@code ALERT} logger. */
public class LoggingOperatorAlerts implements OperatorAlerts {

    private static final Logger LOG = LoggerFactory.getLogger("ALERT");

    @Override
    public void disconnected(final String reason) {
        LOG.warn("Chat session disconnected: {}", reason);
    }

    @Override
    public void reconnecting(final int attempt, final Duration delay) {
        LOG.warn("Reconnection attempt {} scheduled in {}s", attempt, delay.toSeconds());
    }

    @Override
    public void reconnected(final int attempts, final Duration downtime) {
        LOG.info("Chat session restored after {} attempt(s), downtime {}s", attempts, downtime.toSeconds());
    }

    @Override
    public void reconnectFailed(final int attempt, final Throwable error) {
        LOG.warn("Reconnection attempt {} failed: {}", attempt, error.getMessage());
    }

    @Override
    public void reconnectExhausted(final int attempts) {
        LOG.error("Reconnection gave up after {} attempts; manual restart required", attempts);
    }

    @Override
    public void authenticationFailed(final String message) {
        LOG.error("Chat session authentication failed, manual action required (re-pair the device): {}", message);
    }

    @Override
    public void healthDegraded(final String reason) {
        LOG.warn("Chat session health check failed: {}", reason);
    }

    @Override
    public void startupFailed(final Throwable error) {
        LOG.error("Notifier failed to start: {}", error.getMessage(), error);
    }
}
