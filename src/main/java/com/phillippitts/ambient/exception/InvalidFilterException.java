package com.phillippitts.ambient.exception;

/**
 * Thrown when an app or audio filter fails validation on registration.
 */
public class InvalidFilterException extends ConfigurationValidationException {

    public InvalidFilterException(String field, String message) {
        super(field, message);
    }

    public InvalidFilterException(String field, String message, Throwable cause) {
        super(field, message, cause);
    }
}
