package com.phillippitts.ambient.service.command.clarifier;

import java.util.List;

/**
 * @param clarifiedIntent one-line restatement of the request
 * @param actionSteps plain commands, e.g. {@code open spotify}
 * @param confidence score in [0,1]
 */
public record ClarifierReply(String clarifiedIntent, List<String> actionSteps, double confidence) {

    public ClarifierReply {
        actionSteps = actionSteps == null ? List.of() : List.copyOf(actionSteps);
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }
}
