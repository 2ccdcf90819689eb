package com.phillippitts.ambient.service.audio;

import java.time.Duration;
import java.time.Instant;

/**
 * One block of PCM audio read from an {@link AudioSource}.
 *
 * @param sourceName source that produced the chunk
 * @param pcm PCM16LE mono samples
 * @param level normalised loudness in [0,1]
 * @param capturedAt time the first sample of the chunk was captured
 */
public record AudioChunk(String sourceName, byte[] pcm, double level, Instant capturedAt) {

    public AudioChunk {
        if (pcm == null) {
            pcm = new byte[0];
        }
        if (capturedAt == null) {
            throw new IllegalArgumentException("capturedAt must not be null");
        }
    }

    public Duration duration() {
        return Duration.ofMillis(AudioFormat.bytesToMillis(pcm.length));
    }

    public Instant endsAt() {
        return capturedAt.plus(duration());
    }
}
