package com.phillippitts.ambient.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A contiguous utterance captured by the audio sentinel.
 *
 * <p>While speech continues the sentinel hands out views with {@code finalized=false};
 * the view published after a silence timeout (or stop) has {@code finalized=true}.
 *
 * @param id session identifier, stable across views of the same utterance
 * @param transcript text transcribed so far
 * @param sourceName audio source that produced the utterance
 * @param startTime time of the first voiced chunk
 * @param endTime end of the last voiced chunk; null while still open
 * @param finalized whether the session is sealed
 */
public record AudioSession(UUID id,
                           String transcript,
                           String sourceName,
                           Instant startTime,
                           Instant endTime,
                           boolean finalized) {

    public AudioSession {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        transcript = transcript == null ? "" : transcript;
    }

    /** Voiced duration, or zero when the session is still open. */
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }
}
