package com.phillippitts.ambient.service.command.clarifier;

import com.phillippitts.ambient.exception.ClarificationException;

/**
 * Last-resort interpreter for commands that neither exact nor fuzzy routing understood.
 */
public interface Clarifier {

    /**
     * @param command normalised command text
     * @param contextSummary one-line description of what the user is doing, may be empty
     * @return proposed interpretation; its action steps are re-routed locally on confirmation
     * @throws ClarificationException when no interpretation can be produced
     */
    ClarifierReply clarify(String command, String contextSummary);
}
