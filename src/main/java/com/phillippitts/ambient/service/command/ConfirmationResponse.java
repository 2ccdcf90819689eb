package com.phillippitts.ambient.service.command;

import java.util.List;

/**
 * @param success false only when the request was unknown or expired, or a confirmed step failed
 * @param executed whether any step ran
 * @param results one response per action step, in order
 * @param message summary
 */
public record ConfirmationResponse(boolean success, boolean executed, List<CommandResponse> results, String message) {

    public ConfirmationResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
