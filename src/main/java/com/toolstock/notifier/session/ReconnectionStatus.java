package com.toolstock.notifier.session;

import java.time.Duration;

/** Point-in-time view of the {@link ReconnectionController}, for diagnostics. */
public final class ReconnectionStatus {

    private final int      count;
    private final int      maxAttempts;
    private final Duration nextDelay;
    private final boolean  reconnecting;
    private final boolean  exhausted;

    public ReconnectionStatus(
            final int count,
            final int maxAttempts,
            final Duration nextDelay,
            final boolean reconnecting,
            final boolean exhausted) {
        this.count        = count;
        this.maxAttempts  = maxAttempts;
        this.nextDelay    = nextDelay;
        this.reconnecting = reconnecting;
        this.exhausted    = exhausted;
    }

    public int      getCount()        { return count; }
    public int      getMaxAttempts()  { return maxAttempts; }
    public Duration getNextDelay()    { return nextDelay; }
    public boolean  isReconnecting()  { return reconnecting; }
    public boolean  isExhausted()     { return exhausted; }

    @Override
    public String toString() {
        return "ReconnectionStatus{count=" + count + "/" + maxAttempts
             + ", nextDelay=" + nextDelay.toSeconds() + "s"
             + ", reconnecting=" + reconnecting
             + ", exhausted=" + exhausted + "}";
    }
}
