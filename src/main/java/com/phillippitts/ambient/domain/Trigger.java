package com.phillippitts.ambient.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One firing of a context pattern against a snapshot.
 */
public record Trigger(String patternName, List<String> triggerActions, UUID snapshotId, Instant firedAt) {

    public Trigger {
        triggerActions = triggerActions == null ? List.of() : List.copyOf(triggerActions);
    }
}
