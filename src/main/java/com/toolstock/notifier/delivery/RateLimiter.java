package com.toolstock.notifier.delivery;

import com.toolstock.notifier.error.TransientTransportException;
import com.toolstock.notifier.scheduling.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide gate enforcing a minimum spacing between dispatch starts.
 * Callers are serialized: a second caller waits behind the first one's pause.
 */
public class RateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    private final Clock   clock;
    private final Sleeper sleeper;

    private volatile Duration delay;
    private Instant           lastDispatch; // guarded by this

    public RateLimiter(final Duration delay, final Clock clock, final Sleeper sleeper) {
        this.delay   = requireNonNegative(delay);
        this.clock   = clock;
        this.sleeper = sleeper;
    }

    /**
     * Pause until {@code delay} has passed since the previous dispatch, then
     * record this one.
     *
     * @return how long the caller was held back
     * @throws TransientTransportException the pause was cut short by an interrupt;
     *         nothing is recorded and the caller must not dispatch
     */
    public synchronized Duration waitIfNeeded() {
        Duration waited = Duration.ZERO;
        if (lastDispatch != null) {
            final Duration elapsed = Duration.between(lastDispatch, clock.instant());
            final Duration remaining = delay.minus(elapsed);
            if (!remaining.isNegative() && !remaining.isZero()) {
                LOG.info("Rate limit: waiting {}ms before next dispatch", remaining.toMillis());
                sleeper.sleep(remaining);
                if (Thread.currentThread().isInterrupted()) {
                    throw new TransientTransportException(
                            "interrupted while rate limited, " + remaining.toMillis() + "ms wait not served");
                }
                waited = remaining;
            }
        }
        lastDispatch = clock.instant();
        return waited;
    }

    /** Takes effect on the next {@link #waitIfNeeded()}. */
    public void setDelay(final Duration delay) {
        this.delay = requireNonNegative(delay);
        LOG.info("Rate limit delay set to {}ms", delay.toMillis());
    }

    public Duration getDelay() {
        return delay;
    }

    public synchronized Instant getLastDispatch() {
        return lastDispatch;
    }

    private static Duration requireNonNegative(final Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
        return delay;
    }
}
