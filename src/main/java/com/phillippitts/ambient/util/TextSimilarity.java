package com.phillippitts.ambient.util;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * String similarity measures used by fuzzy command routing and screen change detection.
 */
public final class TextSimilarity {

    private TextSimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * Optimal string alignment distance: insertions, deletions, substitutions and
     * transpositions of adjacent characters each cost 1.
     */
    public static int editDistance(String a, String b) {
        String s = a == null ? "" : a;
        String t = b == null ? "" : b;
        int n = s.length();
        int m = t.length();
        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int cost = s.charAt(i - 1) == t.charAt(j - 1) ? 0 : 1;
                int best = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1
                        && s.charAt(i - 1) == t.charAt(j - 2)
                        && s.charAt(i - 2) == t.charAt(j - 1)) {
                    best = Math.min(best, d[i - 2][j - 2] + 1);
                }
                d[i][j] = best;
            }
        }
        return d[n][m];
    }

    /**
     * Normalised similarity in [0,1]: {@code 1 - distance / max(len)}. Two empty strings are 1.0.
     */
    public static double similarity(String a, String b) {
        String s = a == null ? "" : a;
        String t = b == null ? "" : b;
        int max = Math.max(s.length(), t.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - ((double) editDistance(s, t) / max);
    }

    /**
     * Jaccard similarity of the lower-cased word sets of two texts. Two blank texts are 1.0.
     */
    public static double jaccard(String a, String b) {
        Set<String> left = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> out = new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).trim().split("\\s+")));
        out.remove("");
        return out;
    }
}
