package com.phillippitts.ambient.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Fused view of the newest screen and audio state at one point in time.
 *
 * @param screen newest screen snapshot, may be null
 * @param audio newest sealed audio session, may be null
 * @param userIntent derived activity, may be null when nothing is known yet
 * @param quietHours whether the snapshot was recorded inside the quiet window
 */
public record ContextSnapshot(UUID id,
                              String appName,
                              String windowTitle,
                              ScreenSnapshot screen,
                              AudioSession audio,
                              ActivityIntent userIntent,
                              Instant timestamp,
                              boolean quietHours) {

    public String screenText() {
        return screen == null ? "" : screen.extractedText();
    }

    public String transcript() {
        return audio == null ? "" : audio.transcript();
    }
}
