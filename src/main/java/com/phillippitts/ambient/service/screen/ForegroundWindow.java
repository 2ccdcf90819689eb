package com.phillippitts.ambient.service.screen;

/**
 * The application and window the user is currently looking at.
 */
public record ForegroundWindow(String appName, String windowTitle) {

    public ForegroundWindow {
        appName = appName == null ? "" : appName.trim();
        windowTitle = windowTitle == null ? "" : windowTitle.trim();
    }
}
