package com.toolstock.notifier.error;

/** The session did not reach {@code STABLE} within the allowed wait. */
public class ReadyTimeoutException extends TransientTransportException {

    public ReadyTimeoutException(final String message) {
        super(message);
    }
}
