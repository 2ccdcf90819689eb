package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.exception.TranscriptionException;

/**
 * Speech-to-text backend for windows of PCM16LE mono 16 kHz audio.
 */
public interface Transcriber {

    /**
     * @param pcm audio window
     * @return recognised text, possibly empty
     * @throws TranscriptionException if the backend fails
     */
    String transcribe(byte[] pcm);
}
