package com.phillippitts.ambient.domain;

import java.util.List;

/**
 * User-authored rule mapping a situation to proactive actions.
 *
 * <p>A pattern matches when the app and window constraints hold and, if any keyword list is
 * non-empty, at least one audio keyword appears in the transcript or at least one screen keyword
 * appears in the screen text. Blank {@code appName} or {@code "*"} matches any app.
 *
 * @param patternName unique name
 * @param appName required foreground app, blank or {@code *} for any
 * @param windowPattern title substring or regular expression, blank for any
 * @param audioKeywords words looked for in the audio transcript
 * @param screenKeywords words looked for in the extracted screen text
 * @param triggerActions commands issued when the pattern fires
 * @param active inactive patterns are kept but never evaluated; defaults to true
 */
public record ContextPattern(String patternName,
                             String appName,
                             String windowPattern,
                             List<String> audioKeywords,
                             List<String> screenKeywords,
                             List<String> triggerActions,
                             Boolean active) {

    public ContextPattern {
        audioKeywords = audioKeywords == null ? List.of() : List.copyOf(audioKeywords);
        screenKeywords = screenKeywords == null ? List.of() : List.copyOf(screenKeywords);
        triggerActions = triggerActions == null ? List.of() : List.copyOf(triggerActions);
        active = active == null ? Boolean.TRUE : active;
    }

    public boolean isActive() {
        return active;
    }

    public boolean hasKeywords() {
        return !audioKeywords.isEmpty() || !screenKeywords.isEmpty();
    }
}
