package com.phillippitts.ambient.service.command;

import jakarta.validation.constraints.NotBlank;

/**
 * @param requestId id of the pending clarification
 * @param confirmed true to execute the proposed steps, false to discard them
 * @param sessionId caller session, optional
 */
public record ConfirmationRequest(@NotBlank String requestId, boolean confirmed, String sessionId) { }
