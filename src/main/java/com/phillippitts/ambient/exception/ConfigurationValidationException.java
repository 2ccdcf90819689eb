package com.phillippitts.ambient.exception;

/**
 * Thrown when user-authored configuration (filters, context patterns) is rejected at
 * registration time. Maps to HTTP 400 at the REST boundary.
 */
public class ConfigurationValidationException extends AmbientException {

    private final String field;

    public ConfigurationValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ConfigurationValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /** Name of the offending field, e.g. {@code volumeThreshold}. */
    public String getField() {
        return field;
    }
}
