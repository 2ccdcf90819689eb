package com.phillippitts.ambient.util;

/** Utility for privacy-safe logging of transcript, screen-text and command previews. */
public final class LogSanitizer {

    private static final int DEFAULT_PREVIEW = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of at most 40 characters with an ellipsis marker when cut.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= DEFAULT_PREVIEW) {
            return oneLine;
        }
        return truncate(oneLine, DEFAULT_PREVIEW) + "...";
    }
}
