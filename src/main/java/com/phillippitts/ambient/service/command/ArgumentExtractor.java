package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.domain.IntentCategory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts category-specific arguments from the text that follows the trigger phrase.
 */
final class ArgumentExtractor {

    private static final Pattern URL = Pattern.compile(
            "^(https?://\\S+|www\\.\\S+|[a-z0-9-]+(\\.[a-z0-9-]+)*\\.[a-z]{2,}(/\\S*)?)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECIPIENT = Pattern.compile(
            "([a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,})", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMED_RECIPIENT = Pattern.compile("\\bto\\s+([^\\s,]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_KEYWORD = Pattern.compile(
            "\\b(?:subject|about|body|content|message)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBJECT = Pattern.compile(
            "\\b(?:subject|about)\\s+(.+?)(?:\\s+body|\\s+content|\\s+message|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY = Pattern.compile(
            "\\b(?:body|content|message)\\s+(.+)", Pattern.CASE_INSENSITIVE);

    /**
     * Extracted arguments.
     *
     * @param args argument values by name
     * @param quality 1.0 unless an app name was resolved fuzzily
     */
    record Extraction(Map<String, String> args, double quality) { }

    private final AppCatalog catalog;

    ArgumentExtractor(AppCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog);
    }

    /**
     * @param phrase trigger phrase that selected the category; {@code go to} and {@code navigate to}
     *               treat a bare word as a domain
     * @param remainder whitespace-collapsed text after the phrase in its original case, possibly empty
     */
    Extraction extract(IntentCategory category, String phrase, String remainder) {
        String rest = remainder == null ? "" : remainder.trim();
        return switch (category) {
            case OPEN -> extractOpen(phrase, rest);
            case SEARCH, VIDEO -> new Extraction(Map.of("query", stripLeadingFor(rest)), 1.0);
            case EMAIL -> new Extraction(extractEmail(rest), 1.0);
            case HELP, UNKNOWN -> new Extraction(Map.of(), 1.0);
        };
    }

    private Extraction extractOpen(String phrase, String target) {
        if (target.isEmpty()) {
            return new Extraction(Map.of(), 1.0);
        }
        if (URL.matcher(target).matches()) {
            return new Extraction(Map.of("url", toUrl(target)), 1.0);
        }
        boolean navigation = "go to".equals(phrase) || "navigate to".equals(phrase);
        var match = catalog.resolve(target);
        if (match.isPresent()) {
            return new Extraction(Map.of("app", match.get().app().key()), match.get().quality());
        }
        if (navigation && !target.contains(" ")) {
            return new Extraction(Map.of("url", "https://" + target.toLowerCase(Locale.ROOT) + ".com"), 1.0);
        }
        return new Extraction(Map.of("app", target), 1.0);
    }

    private static Map<String, String> extractEmail(String text) {
        Map<String, String> args = new HashMap<>();
        Matcher r = RECIPIENT.matcher(text);
        if (r.find()) {
            args.put("recipient", r.group(1));
        } else {
            namedRecipient(text).ifPresent(name -> args.put("recipient", name));
        }
        Matcher s = SUBJECT.matcher(text);
        if (s.find()) {
            args.put("subject", s.group(1).trim());
        }
        Matcher b = BODY.matcher(text);
        if (b.find()) {
            args.put("body", b.group(1).trim());
        }
        return args;
    }

    /** {@code to <name>} ahead of any subject or body keyword, for "email to manager ..." style commands. */
    private static Optional<String> namedRecipient(String text) {
        Matcher keyword = FIELD_KEYWORD.matcher(text);
        String head = keyword.find() ? text.substring(0, keyword.start()) : text;
        Matcher to = NAMED_RECIPIENT.matcher(head);
        return to.find() ? Optional.of(to.group(1)) : Optional.empty();
    }

    private static String stripLeadingFor(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("for")) {
            return "";
        }
        return lower.startsWith("for ") ? text.substring(4).trim() : text;
    }

    private static String toUrl(String target) {
        String lower = target.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") ? target : "https://" + target;
    }
}
