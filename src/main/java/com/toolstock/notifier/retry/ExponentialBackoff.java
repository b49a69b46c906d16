package com.toolstock.notifier.retry;

import java.time.Duration;

/**
 * Deterministic exponential backoff.
 *
 * <pre>
 *   delay(n) = min(initialDelay × factor^n, maxDelay)      n = 0, 1, 2, …
 * </pre>
 *
 * <p>A factor of {@code 1.0} gives a constant delay. No jitter: reconnection
 * delays are part of the observable contract (30s, 60s, 120s, 240s, 300s).
 */
public final class ExponentialBackoff {

    private final long   initialDelayMs;
    private final double factor;
    private final long   maxDelayMs;

    public ExponentialBackoff(final Duration initialDelay, final double factor, final Duration maxDelay) {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0, got: " + initialDelay);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1, got: " + factor);
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.initialDelayMs = initialDelay.toMillis();
        this.factor         = factor;
        this.maxDelayMs     = maxDelay.toMillis();
    }

    /** @param n zero-based retry index */
    public Duration delayFor(final int n) {
        if (n <= 0) {
            return Duration.ofMillis(initialDelayMs);
        }
        final double raw = initialDelayMs * Math.pow(factor, n);
        // Math.pow overflows to Infinity long before the cast matters
        final long capped = raw >= maxDelayMs ? maxDelayMs : (long) raw;
        return Duration.ofMillis(capped);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }
}
