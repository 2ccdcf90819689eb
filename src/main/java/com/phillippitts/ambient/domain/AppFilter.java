package com.phillippitts.ambient.domain;

import java.util.List;

/**
 * Screen-sensing rule for one application.
 *
 * <p>When both flags are set the filter is evaluated as a blacklist entry.
 * {@code windowPatterns} narrows a whitelist entry to windows whose title contains one of
 * the patterns (case-insensitive).
 *
 * @param appName application name, compared case-insensitively
 * @param whitelisted whether the app is explicitly allowed
 * @param blacklisted whether the app is never sensed
 * @param windowPatterns title fragments that must match for a whitelisted app; empty = any window
 */
public record AppFilter(String appName, boolean whitelisted, boolean blacklisted, List<String> windowPatterns) {

    public AppFilter {
        windowPatterns = windowPatterns == null ? List.of() : List.copyOf(windowPatterns);
    }

    public static AppFilter blacklist(String appName) {
        return new AppFilter(appName, false, true, List.of());
    }

    public static AppFilter whitelist(String appName, String... windowPatterns) {
        return new AppFilter(appName, true, false, List.of(windowPatterns));
    }
}
