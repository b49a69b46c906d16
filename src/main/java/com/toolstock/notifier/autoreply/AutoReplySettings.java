package com.toolstock.notifier.autoreply;

import com.toolstock.notifier.config.NotifierConfig;

import java.time.Duration;

public final class AutoReplySettings {

    private final Duration replyDelay;
    private final Duration naturalDelay;
    private final Duration suppressionWindow;
    private final Duration echoWindow;
    private final Duration sendTimeout;

    public AutoReplySettings(
            final Duration replyDelay,
            final Duration naturalDelay,
            final Duration suppressionWindow,
            final Duration echoWindow,
            final Duration sendTimeout) {
        this.replyDelay        = replyDelay;
        this.naturalDelay      = naturalDelay;
        this.suppressionWindow = suppressionWindow;
        this.echoWindow        = echoWindow;
        this.sendTimeout       = sendTimeout;
    }

    public static AutoReplySettings from(final NotifierConfig config) {
        return new AutoReplySettings(
                config.getAutoReplyDelay(),
                config.getAutoReplyNaturalDelay(),
                config.getAutoReplySuppressionWindow(),
                config.getAutoReplyEchoWindow(),
                config.getAutoReplySendTimeout());
    }

    public Duration getReplyDelay()        { return replyDelay; }
    public Duration getNaturalDelay()      { return naturalDelay; }
    public Duration getSuppressionWindow() { return suppressionWindow; }
    public Duration getEchoWindow()        { return echoWindow; }
    public Duration getSendTimeout()       { return sendTimeout; }
}
