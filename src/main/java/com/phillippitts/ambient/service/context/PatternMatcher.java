package com.phillippitts.ambient.service.context;

import com.phillippitts.ambient.domain.ContextPattern;
import com.phillippitts.ambient.domain.ContextSnapshot;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a context pattern holds for a snapshot.
 *
 * <p>App and window constraints are ANDed. Keyword lists are ORed with each other: a pattern with
 * keywords matches when any audio keyword is in the transcript or any screen keyword is in the
 * screen text. A window pattern matches as a case-insensitive substring of the title, or as a
 * regular expression found in it.
 */
final class PatternMatcher {

    boolean matches(ContextPattern pattern, ContextSnapshot snapshot) {
        return appMatches(pattern.appName(), snapshot.appName())
                && windowMatches(pattern.windowPattern(), snapshot.windowTitle())
                && keywordsMatch(pattern, snapshot);
    }

    /**
     * Compiles a window pattern, throwing {@link PatternSyntaxException} for malformed input.
     */
    static Pattern compile(String windowPattern) {
        return Pattern.compile(windowPattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static boolean appMatches(String wanted, String actual) {
        if (wanted == null || wanted.isBlank() || "*".equals(wanted.trim())) {
            return true;
        }
        return actual != null && wanted.trim().equalsIgnoreCase(actual.trim());
    }

    private static boolean windowMatches(String windowPattern, String title) {
        if (windowPattern == null || windowPattern.isBlank()) {
            return true;
        }
        String t = title == null ? "" : title;
        if (lower(t).contains(lower(windowPattern))) {
            return true;
        }
        try {
            return compile(windowPattern).matcher(t).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static boolean keywordsMatch(ContextPattern pattern, ContextSnapshot snapshot) {
        if (!pattern.hasKeywords()) {
            return true;
        }
        return containsAny(snapshot.transcript(), pattern.audioKeywords())
                || containsAny(snapshot.screenText(), pattern.screenKeywords());
    }

    private static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isEmpty() || keywords.isEmpty()) {
            return false;
        }
        String haystack = lower(text);
        for (String k : keywords) {
            if (k != null && !k.isBlank() && haystack.contains(lower(k.trim()))) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
