package com.toolstock.notifier.error;

/**
 * Base type for every failure raised by the notifier core.
 *
 * <p>Unchecked on purpose: per-job failures are converted into a typed
 * {@link com.toolstock.notifier.model.SendResult} at the pipeline boundary,
 * so callers above that layer never see these.
 */
public class NotifierException extends RuntimeException {

    public NotifierException(final String message) {
        super(message);
    }

    public NotifierException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
