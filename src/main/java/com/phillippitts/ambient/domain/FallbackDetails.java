package com.phillippitts.ambient.domain;

/**
 * Reason-specific parameters of a fallback request. Every field is optional.
 */
public record FallbackDetails(String appName,
                              String appUrl,
                              String oauthProvider,
                              String permissionType,
                              String action) {

    public static FallbackDetails empty() {
        return new FallbackDetails(null, null, null, null, null);
    }

    public static FallbackDetails forApp(String appName, String appUrl) {
        return new FallbackDetails(appName, appUrl, null, null, null);
    }

    public static FallbackDetails forPermission(String permissionType) {
        return new FallbackDetails(null, null, null, permissionType, null);
    }

    public static FallbackDetails forOAuth(String provider) {
        return new FallbackDetails(null, null, provider, null, null);
    }

    public static FallbackDetails forAction(String action) {
        return new FallbackDetails(null, null, null, null, action);
    }
}
