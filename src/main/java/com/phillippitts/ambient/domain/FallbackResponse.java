package com.phillippitts.ambient.domain;

import java.util.List;

/**
 * Recovery guidance for a failed action.
 */
public record FallbackResponse(boolean success, String message, FallbackAction action, List<String> nextSteps) {

    public FallbackResponse {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }
}
