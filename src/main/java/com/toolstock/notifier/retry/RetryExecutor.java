package com.toolstock.notifier.retry;

import com.toolstock.notifier.config.NotifierConfig;
import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.error.TransientTransportException;
import com.toolstock.notifier.error.ValidationException;
import com.toolstock.notifier.scheduling.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Executes a transport call with bounded attempts and backoff.
 *
 * <p>{@link AuthenticationException} and {@link ValidationException} are
 * permanent: they are rethrown on the first occurrence. Any other exception
 * is retried. After the last attempt a {@link TransientTransportException}
 * carrying the last cause is thrown.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   delay(attempt) = min(initialDelay × factor^(attempt-1), maxDelay)
 * </pre>
 */
public class RetryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    private final int                maxAttempts;
    private final ExponentialBackoff backoff;
    private final Sleeper            sleeper;

    public RetryExecutor(final NotifierConfig config, final Sleeper sleeper) {
        this(config.getRetryMaxAttempts(),
             new ExponentialBackoff(
                     Duration.ofMillis(config.getRetryInitialDelayMs()),
                     config.getRetryBackoffFactor(),
                     Duration.ofMillis(config.getRetryMaxDelayMs())),
             sleeper);
    }

    public RetryExecutor(final int maxAttempts, final ExponentialBackoff backoff, final Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff     = backoff;
        this.sleeper     = sleeper;
    }

    /**
     * Execute {@code operation}, retrying on failure.
     *
     * @param operation   the call to attempt
     * @param description human-readable description for log messages
     * @param beforeRetry run after each backoff pause and before the next
     *                    attempt, e.g. re-checking the session; its exceptions propagate
     * @return the first successful result
     */
    public <T> T execute(
            final Callable<T> operation,
            final String description,
            final Runnable beforeRetry) {

        Exception last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                final T result = operation.call();
                if (attempt > 1) {
                    LOG.info("Retry succeeded: {} on attempt {}/{}", description, attempt, maxAttempts);
                }
                return result;
            } catch (AuthenticationException | ValidationException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                LOG.warn("Attempt {}/{} failed: {} — {}", attempt, maxAttempts, description, e.getMessage());

                if (attempt < maxAttempts) {
                    sleeper.sleep(backoff.delayFor(attempt - 1));
                    beforeRetry.run();
                }
            }
        }

        LOG.error("All {} attempts exhausted for: {}", maxAttempts, description);
        throw new TransientTransportException(
                description + " failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
