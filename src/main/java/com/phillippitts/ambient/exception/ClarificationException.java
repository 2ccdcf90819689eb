package com.phillippitts.ambient.exception;

/**
 * Thrown by a clarifier when the completion backend is unavailable or returns
 * a reply that cannot be parsed into an intent with action steps.
 */
public class ClarificationException extends AmbientException {

    public ClarificationException(String message) {
        super(message);
    }

    public ClarificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
