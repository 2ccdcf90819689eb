package com.phillippitts.ambient.domain;

import java.time.Instant;
import java.util.List;

/**
 * A clarifier proposal awaiting user confirmation.
 *
 * @param requestId key used to confirm or decline
 * @param sessionId owning session; one pending clarification per session
 * @param clarifiedIntent one-line restatement of what the user meant
 * @param actionSteps commands executed in order on confirmation
 * @param confidence clarifier-reported score in [0,1]
 * @param expiresAt after this instant the proposal can no longer be confirmed
 */
public record Clarification(String requestId,
                            String sessionId,
                            String clarifiedIntent,
                            List<String> actionSteps,
                            double confidence,
                            Instant expiresAt) {

    public Clarification {
        actionSteps = actionSteps == null ? List.of() : List.copyOf(actionSteps);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
