package com.phillippitts.ambient.exception;

/**
 * Thrown when a context pattern fails validation on registration
 * (blank or duplicate name, malformed window pattern, no trigger actions).
 */
public class InvalidPatternException extends ConfigurationValidationException {

    public InvalidPatternException(String field, String message) {
        super(field, message);
    }

    public InvalidPatternException(String field, String message, Throwable cause) {
        super(field, message, cause);
    }
}
