package com.phillippitts.ambient.service.screen;

import com.phillippitts.ambient.exception.ExtractionException;

/**
 * Reports the current foreground window.
 */
public interface ForegroundWindowProbe {

    /**
     * @return the foreground window, or null when no window has focus
     * @throws ExtractionException if the platform query fails
     */
    ForegroundWindow probe();
}
