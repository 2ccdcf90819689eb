package com.phillippitts.ambient.domain;

import java.util.List;

/**
 * Audio-sensing rule for one source (e.g. {@code microphone}, {@code system}).
 *
 * @param sourceName audio source name, compared case-insensitively
 * @param whitelisted whether the source is explicitly allowed
 * @param blacklisted whether the source is never sensed
 * @param volumeThreshold normalised level in [0,1] above which a chunk counts as speech;
 *                        null falls back to {@code ambient.audio.volume-threshold}
 * @param keywords when non-empty, sessions from this source are kept only if their
 *                 transcript mentions one of these words
 */
public record AudioFilter(String sourceName,
                          boolean whitelisted,
                          boolean blacklisted,
                          Double volumeThreshold,
                          List<String> keywords) {

    public AudioFilter {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
