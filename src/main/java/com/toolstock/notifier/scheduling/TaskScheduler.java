package com.toolstock.notifier.scheduling;

import java.time.Duration;

/**
 * Timer abstraction used by every component that waits on a delay: the session
 * settle timer, reconnection backoff, health probes and auto-reply debouncing.
 *
 * <p>Production code uses {@link ExecutorTaskScheduler}; tests drive time by hand.
 */
public interface TaskScheduler {

    ScheduledHandle schedule(Runnable task, Duration delay);

    ScheduledHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);
}
