package com.phillippitts.ambient.service.perception;

import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.context.ContextStatus;

/**
 * Snapshot of sentinel and context engine state for the status endpoint.
 */
public record PerceptionStatus(boolean ultraLightweight,
                               boolean screenRunning,
                               boolean audioRunning,
                               AudioSentinel.State audioState,
                               ContextStatus context) { }
