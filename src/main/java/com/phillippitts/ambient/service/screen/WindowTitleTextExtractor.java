package com.phillippitts.ambient.service.screen;

import org.springframework.stereotype.Component;

/**
 * Fallback extractor used when no OCR or accessibility backend is configured.
 */
@Component
public class WindowTitleTextExtractor implements TextExtractor {

    @Override
    public String extract(ForegroundWindow window) {
        return window.windowTitle();
    }
}
