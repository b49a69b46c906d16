package com.toolstock.notifier.error;

/**
 * A timeout or a transient state mismatch on the chat transport.
 * Retried locally with bounded attempts; exhaustion surfaces to the caller.
 */
public class TransientTransportException extends NotifierException {

    public TransientTransportException(final String message) {
        super(message);
    }

    public TransientTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
