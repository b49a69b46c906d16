package com.toolstock.notifier.error;

/**
 * The transport rejected our credentials. Terminal: nothing retries this
 * automatically, the linked device has to be paired again by an operator.
 */
public class AuthenticationException extends NotifierException {

    public AuthenticationException(final String message) {
        super(message);
    }

    public AuthenticationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
