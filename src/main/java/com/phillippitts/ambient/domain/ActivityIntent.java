package com.phillippitts.ambient.domain;

import java.util.List;

/**
 * Best guess of what the user is doing, derived from the fused context.
 *
 * @param type one of {@code email_composition}, {@code coding}, {@code information_search},
 *             {@code communication}, {@code general_activity}
 * @param confidence score in [0,1]
 * @param suggestedActions commands that usually help with this activity
 */
public record ActivityIntent(String type, double confidence, List<String> suggestedActions) {

    public ActivityIntent {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1], got " + confidence);
        }
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
