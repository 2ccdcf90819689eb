package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.IntentCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative table of trigger phrases per command category, with synonym and example tables
 * used by fuzzy routing and suggestions.
 */
public final class PhraseTable {

    private static final Map<IntentCategory, List<String>> PHRASES = new EnumMap<>(IntentCategory.class);
    private static final Map<String, IntentCategory> SYNONYMS = new LinkedHashMap<>();
    private static final List<String> EXAMPLES = List.of(
            "open chrome",
            "open spotify",
            "go to github.com",
            "search for react tutorial",
            "look up weather tomorrow",
            "email john@example.com subject lunch body see you at noon",
            "search youtube for lofi music",
            "play jazz piano",
            "help"
    );

    static {
        PHRASES.put(IntentCategory.OPEN, List.of("open", "open app", "open the", "go to", "navigate to"));
        PHRASES.put(IntentCategory.SEARCH, List.of("search for", "search", "look up", "find"));
        PHRASES.put(IntentCategory.EMAIL, List.of("email", "send email", "send an email", "compose email"));
        PHRASES.put(IntentCategory.VIDEO, List.of("search youtube for", "youtube", "play video", "play"));
        PHRASES.put(IntentCategory.HELP, List.of("help", "what can you do", "show help"));

        for (String s : List.of("compose", "send", "mail", "write")) {
            SYNONYMS.put(s, IntentCategory.EMAIL);
        }
        for (String s : List.of("launch", "run", "start")) {
            SYNONYMS.put(s, IntentCategory.OPEN);
        }
        for (String s : List.of("lookup", "google", "browse")) {
            SYNONYMS.put(s, IntentCategory.SEARCH);
        }
        for (String s : List.of("watch", "video")) {
            SYNONYMS.put(s, IntentCategory.VIDEO);
        }
    }

    private static final List<PhraseMatch> BY_LENGTH;

    static {
        List<PhraseMatch> all = new ArrayList<>();
        PHRASES.forEach((category, phrases) -> phrases.forEach(p -> all.add(new PhraseMatch(category, p))));
        all.sort(Comparator.comparingInt((PhraseMatch m) -> m.phrase().length()).reversed());
        BY_LENGTH = List.copyOf(all);
    }

    /**
     * A trigger phrase and its category.
     */
    public record PhraseMatch(IntentCategory category, String phrase) { }

    private PhraseTable() {
        // Utility class
    }

    /**
     * Longest phrase the normalised command equals or starts with (followed by a space).
     */
    public static Optional<PhraseMatch> longestPrefix(String normalized) {
        for (PhraseMatch m : BY_LENGTH) {
            String p = m.phrase();
            if (normalized.equals(p) || normalized.startsWith(p + " ")) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    /** Single-word trigger phrases, the candidates for edit-distance matching. */
    public static List<PhraseMatch> singleWordPhrases() {
        return BY_LENGTH.stream().filter(m -> !m.phrase().contains(" ")).toList();
    }

    public static Optional<IntentCategory> synonym(String word) {
        return Optional.ofNullable(SYNONYMS.get(word));
    }

    public static List<String> phrases(IntentCategory category) {
        return PHRASES.getOrDefault(category, List.of());
    }

    public static List<String> examples() {
        return EXAMPLES;
    }
}
