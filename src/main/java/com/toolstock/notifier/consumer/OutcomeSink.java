package com.toolstock.notifier.consumer;

import com.toolstock.notifier.model.JobOutcome;

/** Receives the outcome of every processed job. */
public interface OutcomeSink extends AutoCloseable {

    void publish(JobOutcome outcome);

    @Override
    default void close() {
    }
}
