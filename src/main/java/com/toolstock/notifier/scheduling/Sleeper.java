package com.toolstock.notifier.scheduling;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pause used at the suspension points of a single job or reply
 * (settle delays, rate limiting, verification grace).
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    };

    /** Pause the calling thread. An interrupt ends the pause early and stays set on the thread. */
    void sleep(Duration duration);
}
