package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.domain.FallbackResponse;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.RoutingOutcome;

import java.util.List;

/**
 * Result of one command.
 *
 * @param success whether the command completed (or a clarification was proposed)
 * @param result human-readable summary
 * @param error failure description, null on success
 * @param intent routed intent
 * @param outcome routing outcome
 * @param clarification proposal to confirm, only for {@code NEEDS_CONFIRMATION}
 * @param fallback recovery guidance when the action could not be completed
 * @param nextSteps follow-up hints
 */
public record CommandResponse(boolean success,
                              String result,
                              String error,
                              Intent intent,
                              RoutingOutcome outcome,
                              Clarification clarification,
                              FallbackResponse fallback,
                              List<String> nextSteps) {

    public CommandResponse {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }
}
