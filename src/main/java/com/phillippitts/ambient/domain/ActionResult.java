package com.phillippitts.ambient.domain;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running an action handler.
 *
 * @param success whether the action completed
 * @param message human-readable summary
 * @param nextSteps follow-up hints shown to the user
 * @param data handler-specific values (e.g. the opened URL)
 * @param fallback set when the action could not be satisfied and needs recovery guidance
 */
public record ActionResult(boolean success,
                           String message,
                           List<String> nextSteps,
                           Map<String, String> data,
                           FallbackRequest fallback) {

    public ActionResult {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ActionResult ok(String message, List<String> nextSteps, Map<String, String> data) {
        return new ActionResult(true, message, nextSteps, data, null);
    }

    public static ActionResult failed(String message, List<String> nextSteps) {
        return new ActionResult(false, message, nextSteps, Map.of(), null);
    }

    public static ActionResult needsFallback(String message, FallbackRequest fallback) {
        return new ActionResult(false, message, List.of(), Map.of(), fallback);
    }
}
