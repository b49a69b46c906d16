package com.toolstock.notifier.session;

import com.toolstock.notifier.config.NotifierConfig;

import java.time.Duration;

public final class ReconnectSettings {

    private final int      maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration settleDelay;
    private final Duration followUpDelay;

    public ReconnectSettings(
            final int maxAttempts,
            final Duration baseDelay,
            final Duration maxDelay,
            final Duration settleDelay,
            final Duration followUpDelay) {
        this.maxAttempts   = maxAttempts;
        this.baseDelay     = baseDelay;
        this.maxDelay      = maxDelay;
        this.settleDelay   = settleDelay;
        this.followUpDelay = followUpDelay;
    }

    public static ReconnectSettings from(final NotifierConfig config) {
        return new ReconnectSettings(
                config.getReconnectMaxAttempts(),
                config.getReconnectBaseDelay(),
                config.getReconnectMaxDelay(),
                config.getReconnectSettleDelay(),
                config.getReconnectFollowUpDelay());
    }

    public int      getMaxAttempts()   { return maxAttempts; }
    public Duration getBaseDelay()     { return baseDelay; }
    public Duration getMaxDelay()      { return maxDelay; }
    public Duration getSettleDelay()   { return settleDelay; }
    public Duration getFollowUpDelay() { return followUpDelay; }
}
