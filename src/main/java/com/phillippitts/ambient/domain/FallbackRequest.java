package com.phillippitts.ambient.domain;

/**
 * Request for recovery guidance.
 *
 * @param reason failure class; null when the caller sent an unrecognised reason
 * @param proposal free-text description of what was attempted
 * @param details reason-specific parameters, never null after construction
 */
public record FallbackRequest(FallbackReason reason, String proposal, FallbackDetails details) {

    public FallbackRequest {
        details = details == null ? FallbackDetails.empty() : details;
        proposal = proposal == null ? "" : proposal;
    }
}
