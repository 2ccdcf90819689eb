package com.phillippitts.ambient.service.command.clarifier;

import com.phillippitts.ambient.exception.ClarificationException;
import org.springframework.stereotype.Component;

/**
 * Default completion client when no backend bean is provided; always fails, so commands that
 * need clarification end up unresolved.
 */
@Component
public class UnconfiguredCompletionClient implements CompletionClient {

    @Override
    public String complete(String prompt) {
        throw new ClarificationException("No completion backend configured");
    }
}
