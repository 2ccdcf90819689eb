package com.phillippitts.ambient.exception;

/**
 * Thrown when an application, URL or mail client cannot be launched.
 */
public class LaunchException extends AmbientException {

    private final String target;

    public LaunchException(String message, String target) {
        super(message + " (target: " + target + ")");
        this.target = target;
    }

    public LaunchException(String message, String target, Throwable cause) {
        super(message + " (target: " + target + ")", cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
