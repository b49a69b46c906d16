package com.toolstock.notifier.scheduling;

/** A cancellable reference to a task submitted to a {@link TaskScheduler}. */
public interface ScheduledHandle {

    /**
     * Cancel the task if it has not run yet. A running task is not interrupted.
     *
     * @return {@code true} if this call prevented the task from running
     */
    boolean cancel();

    boolean isDone();
}
