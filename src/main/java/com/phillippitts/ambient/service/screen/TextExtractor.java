package com.phillippitts.ambient.service.screen;

import com.phillippitts.ambient.exception.ExtractionException;

/**
 * Extracts the visible text of a window (OCR, accessibility tree, or similar).
 *
 * <p>The default {@link WindowTitleTextExtractor} returns the title only. Richer extractors
 * are contributed as {@code @Primary} beans.
 */
public interface TextExtractor {

    /**
     * @param window window whose content should be read
     * @return extracted text, never null
     * @throws ExtractionException if extraction fails
     */
    String extract(ForegroundWindow window);
}
