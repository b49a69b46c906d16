package com.toolstock.notifier.delivery;

import com.toolstock.notifier.config.NotifierConfig;

import java.time.Duration;

public final class DeliverySettings {

    private final Duration settleDelay;
    private final Duration sendTimeout;
    private final Duration channelCheckTimeout;
    private final Duration verificationGrace;
    private final Duration verificationTimeout;
    private final Duration verificationTolerance;
    private final int      verificationPrefixLength;

    public DeliverySettings(
            final Duration settleDelay,
            final Duration sendTimeout,
            final Duration channelCheckTimeout,
            final Duration verificationGrace,
            final Duration verificationTimeout,
            final Duration verificationTolerance,
            final int verificationPrefixLength) {
        this.settleDelay              = settleDelay;
        this.sendTimeout              = sendTimeout;
        this.channelCheckTimeout      = channelCheckTimeout;
        this.verificationGrace        = verificationGrace;
        this.verificationTimeout      = verificationTimeout;
        this.verificationTolerance    = verificationTolerance;
        this.verificationPrefixLength = verificationPrefixLength;
    }

    public static DeliverySettings from(final NotifierConfig config) {
        return new DeliverySettings(
                config.getDeliverySettleDelay(),
                config.getSendTimeout(),
                config.getChannelCheckTimeout(),
                config.getVerificationGrace(),
                config.getVerificationTimeout(),
                config.getVerificationTolerance(),
                config.getVerificationPrefixLength());
    }

    public Duration getSettleDelay()              { return settleDelay; }
    public Duration getSendTimeout()              { return sendTimeout; }
    public Duration getChannelCheckTimeout()      { return channelCheckTimeout; }
    public Duration getVerificationGrace()        { return verificationGrace; }
    public Duration getVerificationTimeout()      { return verificationTimeout; }
    public Duration getVerificationTolerance()    { return verificationTolerance; }
    public int      getVerificationPrefixLength() { return verificationPrefixLength; }
}
