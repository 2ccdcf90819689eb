package com.phillippitts.ambient.service.context;

import com.phillippitts.ambient.domain.ActivityIntent;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based guess of the user's current activity from app, title, screen text and transcript.
 * Rules are checked in order; the first hit wins.
 */
final class ActivityIntentClassifier {

    private record Rule(String type, double confidence, List<String> keywords, List<String> suggestions) { }

    private static final List<Rule> RULES = List.of(
            new Rule("email_composition", 0.85, List.of("email", "mail", "inbox", "compose"),
                    List.of("open mail", "compose email")),
            new Rule("coding", 0.9, List.of("code", "programming", "intellij", "vscode", "terminal", "debug"),
                    List.of("open vscode", "search for documentation")),
            new Rule("information_search", 0.8, List.of("search", "find", "google", "look up"),
                    List.of("open chrome", "search for")),
            new Rule("communication", 0.75, List.of("meeting", "call", "zoom", "slack", "discord"),
                    List.of("open zoom", "open discord")));

    private static final ActivityIntent GENERAL = new ActivityIntent("general_activity", 0.5, List.of());

    ActivityIntent classify(String appName, String windowTitle, String screenText, String transcript) {
        String combined = String.join(" ",
                nullToEmpty(appName), nullToEmpty(windowTitle), nullToEmpty(screenText), nullToEmpty(transcript))
                .toLowerCase(Locale.ROOT);
        if (combined.isBlank()) {
            return null;
        }
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(combined::contains)) {
                return new ActivityIntent(rule.type(), rule.confidence(), rule.suggestions());
            }
        }
        return GENERAL;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
