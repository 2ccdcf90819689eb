package com.phillippitts.ambient.service.audio;

import com.phillippitts.ambient.exception.CaptureException;

/**
 * Stream of audio chunks from one input (microphone, system loopback).
 *
 * <p>{@link #read()} is called from a single reader thread. {@link #close()} may be called from
 * another thread and must unblock a pending read.
 */
public interface AudioSource {

    /** Name matched against audio filters, e.g. {@code microphone}. */
    String name();

    /**
     * @throws CaptureException if the input cannot be opened
     */
    void open();

    /**
     * Blocks until the next chunk is available.
     *
     * @return next chunk, or null once the source is closed
     * @throws CaptureException if reading fails
     */
    AudioChunk read();

    void close();
}
