package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.exception.TranscriptionException;
import org.springframework.stereotype.Component;

/**
 * Default transcriber when no speech-to-text engine bean is configured.
 * Every call fails, so utterances are sealed immediately and dropped as empty.
 */
@Component
public class UnavailableTranscriber implements Transcriber {

    @Override
    public String transcribe(byte[] pcm) {
        throw new TranscriptionException("No speech-to-text engine configured", "none");
    }
}
