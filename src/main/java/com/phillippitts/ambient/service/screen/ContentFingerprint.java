package com.phillippitts.ambient.service.screen;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of a window's title and text, used to drop unchanged samples.
 */
final class ContentFingerprint {

    private ContentFingerprint() {
    }

    static String of(String windowTitle, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(nullToEmpty(windowTitle).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
            digest.update(nullToEmpty(text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
