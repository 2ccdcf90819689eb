package com.phillippitts.ambient.exception;

/**
 * Thrown when the foreground window cannot be probed or its text cannot be extracted.
 * Treated as a transient sensing failure by the screen sentinel.
 */
public class ExtractionException extends AmbientException {

    private final String source;

    public ExtractionException(String message, String source) {
        super(message + " (source: " + source + ")");
        this.source = source;
    }

    public ExtractionException(String message, String source, Throwable cause) {
        super(message + " (source: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
