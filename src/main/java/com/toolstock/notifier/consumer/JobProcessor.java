package com.toolstock.notifier.consumer;

import com.toolstock.notifier.delivery.DeliveryPipeline;
import com.toolstock.notifier.delivery.RateLimiter;
import com.toolstock.notifier.model.JobOutcome;
import com.toolstock.notifier.model.SendJob;
import com.toolstock.notifier.model.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs send jobs one at a time through the {@link RateLimiter} gate and the
 * {@link DeliveryPipeline}, and reports each outcome to the {@link OutcomeSink}.
 *
 * <p>A failing job, or a failing sink, never stops the jobs behind it.
 */
public class JobProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(JobProcessor.class);

    private final RateLimiter      rateLimiter;
    private final DeliveryPipeline pipeline;
    private final OutcomeSink      sink;
    private final Clock            clock;

    private final AtomicLong sent      = new AtomicLong();
    private final AtomicLong noChannel = new AtomicLong();
    private final AtomicLong failed    = new AtomicLong();

    public JobProcessor(
            final RateLimiter rateLimiter,
            final DeliveryPipeline pipeline,
            final OutcomeSink sink,
            final Clock clock) {
        this.rateLimiter = rateLimiter;
        this.pipeline    = pipeline;
        this.sink        = sink;
        this.clock       = clock;
    }

    public JobOutcome process(final SendJob job) {
        rateLimiter.waitIfNeeded();
        LOG.info("Processing {}", job);

        final SendResult result = pipeline.send(job);
        switch (result.getStatus()) {
            case SENT       -> sent.incrementAndGet();
            case NO_CHANNEL -> noChannel.incrementAndGet();
            case SEND_ERROR -> failed.incrementAndGet();
        }
        LOG.info("Job {} finished: {}", job.getJobId(), result);

        final JobOutcome outcome = new JobOutcome(job.getJobId(), result, clock.instant());
        try {
            sink.publish(outcome);
        } catch (RuntimeException e) {
            LOG.error("Outcome sink failed for job {}: {}", job.getJobId(), e.getMessage(), e);
        }
        return outcome;
    }

    /** Process {@code jobs} in order. */
    public List<JobOutcome> processAll(final List<SendJob> jobs) {
        final List<JobOutcome> outcomes = new ArrayList<>(jobs.size());
        for (final SendJob job : jobs) {
            outcomes.add(process(job));
        }
        LOG.info("Batch of {} jobs done: {}", jobs.size(), statsLine());
        return outcomes;
    }

    public long getSentCount()      { return sent.get(); }
    public long getNoChannelCount() { return noChannel.get(); }
    public long getFailedCount()    { return failed.get(); }

    public String statsLine() {
        return "sent=" + sent.get() + " noChannel=" + noChannel.get() + " failed=" + failed.get();
    }
}
