package com.toolstock.notifier.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} of daemon threads.
 *
 * <p>Every task is wrapped so that an exception is logged instead of silently
 * parking in the returned future (and, for fixed-rate tasks, cancelling all
 * further runs).
 */
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(final String threadPrefix, final int poolSize) {
        final AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(poolSize, r -> {
            final Thread t = new Thread(r, threadPrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledHandle schedule(final Runnable task, final Duration delay) {
        final ScheduledFuture<?> future = executor.schedule(
                guarded(task), Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public ScheduledHandle scheduleAtFixedRate(
            final Runnable task, final Duration initialDelay, final Duration period) {
        final ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                guarded(task), Math.max(0L, initialDelay.toMillis()), period.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(final Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Scheduled task failed", e);
            }
        };
    }

    private static final class FutureHandle implements ScheduledHandle {

        private final ScheduledFuture<?> future;

        private FutureHandle(final ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override public boolean cancel() { return future.cancel(false); }
        @Override public boolean isDone() { return future.isDone(); }
    }
}
