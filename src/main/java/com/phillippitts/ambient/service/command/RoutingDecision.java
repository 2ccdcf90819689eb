package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.domain.Intent;
import com.phillippitts.ambient.domain.RoutingOutcome;

/**
 * Result of routing one command.
 *
 * @param intent routed intent; {@code UNKNOWN} when nothing matched
 * @param outcome whether the intent can run now
 * @param clarification proposal awaiting confirmation, set only for {@code NEEDS_CONFIRMATION}
 */
public record RoutingDecision(Intent intent, RoutingOutcome outcome, Clarification clarification) {

    public static RoutingDecision ready(Intent intent) {
        return new RoutingDecision(intent, RoutingOutcome.READY, null);
    }

    public static RoutingDecision unresolved(String rawCommand) {
        return new RoutingDecision(Intent.unresolved(rawCommand), RoutingOutcome.UNRESOLVED, null);
    }
}
