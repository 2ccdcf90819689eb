package com.phillippitts.ambient.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable result of one screen sampling tick that produced new content.
 * A later snapshot for the same app supersedes this one; snapshots are never mutated.
 */
public record ScreenSnapshot(UUID id,
                             String appName,
                             String windowTitle,
                             String extractedText,
                             String contentHash,
                             Instant capturedAt) {

    public ScreenSnapshot {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (capturedAt == null) {
            throw new IllegalArgumentException("capturedAt must not be null");
        }
        extractedText = extractedText == null ? "" : extractedText;
        windowTitle = windowTitle == null ? "" : windowTitle;
    }
}
