package com.toolstock.notifier.session;

import com.toolstock.notifier.config.NotifierConfig;

import java.time.Duration;

/** Timing knobs of a {@link ChannelSession}. */
public final class SessionSettings {

    private final Duration readyTimeout;
    private final Duration settleDelay;
    private final Duration probeTimeout;
    private final int      stabilizeAttempts;
    private final Duration stabilizeRetryDelay;

    public SessionSettings(
            final Duration readyTimeout,
            final Duration settleDelay,
            final Duration probeTimeout,
            final int stabilizeAttempts,
            final Duration stabilizeRetryDelay) {
        if (stabilizeAttempts < 1) {
            throw new IllegalArgumentException("stabilizeAttempts must be >= 1, got: " + stabilizeAttempts);
        }
        this.readyTimeout        = readyTimeout;
        this.settleDelay         = settleDelay;
        this.probeTimeout        = probeTimeout;
        this.stabilizeAttempts   = stabilizeAttempts;
        this.stabilizeRetryDelay = stabilizeRetryDelay;
    }

    public static SessionSettings from(final NotifierConfig config) {
        return new SessionSettings(
                config.getSessionReadyTimeout(),
                config.getSessionSettleDelay(),
                config.getSessionProbeTimeout(),
                config.getSessionStabilizeAttempts(),
                config.getSessionStabilizeRetryDelay());
    }

    public Duration getReadyTimeout()        { return readyTimeout; }
    public Duration getSettleDelay()         { return settleDelay; }
    public Duration getProbeTimeout()        { return probeTimeout; }
    public int      getStabilizeAttempts()   { return stabilizeAttempts; }
    public Duration getStabilizeRetryDelay() { return stabilizeRetryDelay; }
}
