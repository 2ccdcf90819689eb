package com.phillippitts.ambient.exception;

/**
 * Thrown when an audio source cannot be opened or read.
 * The reason is a short code such as {@code MIC_UNAVAILABLE}, safe to log and publish.
 */
public class CaptureException extends AmbientException {

    private final String reason;

    public CaptureException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CaptureException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
