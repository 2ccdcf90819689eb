package com.phillippitts.ambient.service.audio.event;

import com.phillippitts.ambient.domain.AudioSession;

/**
 * Published when an utterance is sealed and kept.
 *
 * @param session sealed session
 * @param partial true when transcription failed and the transcript may be incomplete
 */
public record AudioSessionCompletedEvent(AudioSession session, boolean partial) { }
