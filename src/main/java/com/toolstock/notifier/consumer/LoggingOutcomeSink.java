package com.toolstock.notifier.consumer;

import com.toolstock.notifier.model.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code outcomes.sink = log}: one JSON line per job on the {@code OUTCOME} logger. */
public class LoggingOutcomeSink implements OutcomeSink {

    private static final Logger LOG = LoggerFactory.getLogger("OUTCOME");

    @Override
    public void publish(final JobOutcome outcome) {
        LOG.info(outcome.toJson());
    }
}
