package com.phillippitts.ambient.exception;

/**
 * Thrown when a speech-to-text backend fails to transcribe a window of audio.
 * The audio sentinel seals the open session with the transcript accumulated so far.
 */
public class TranscriptionException extends AmbientException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
