package com.phillippitts.ambient.exception;

/**
 * Base exception for all ambient-assistant application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AmbientException extends RuntimeException {

    public AmbientException(String message) {
        super(message);
    }

    public AmbientException(String message, Throwable cause) {
        super(message, cause);
    }

    public AmbientException(Throwable cause) {
        super(cause);
    }
}
