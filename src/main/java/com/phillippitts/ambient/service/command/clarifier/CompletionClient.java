package com.phillippitts.ambient.service.command.clarifier;

/**
 * Text completion backend (a hosted or local language model).
 */
public interface CompletionClient {

    /**
     * @return raw completion text
     * @throws com.phillippitts.ambient.exception.ClarificationException if the backend is unavailable
     */
    String complete(String prompt);
}
