package com.toolstock.notifier.error;

/** Malformed job input, e.g. a recipient that is not a Spanish number. Never retried. */
public class ValidationException extends NotifierException {

    public ValidationException(final String message) {
        super(message);
    }
}
