package com.phillippitts.ambient.service.fallback;

import com.phillippitts.ambient.service.launch.Platform;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step-by-step settings guides per platform and permission type.
 */
final class PermissionGuides {

    private static final String APP = "Ambient Assistant";

    private static final Map<String, List<String>> MAC = Map.of(
            "accessibility", List.of(
                    "Open System Settings > Privacy & Security",
                    "Select \"Accessibility\"",
                    "Unlock to make changes",
                    "Add " + APP + " to the list of allowed apps",
                    "Restart " + APP + " after granting permission"),
            "screen_recording", List.of(
                    "Open System Settings > Privacy & Security",
                    "Select \"Screen Recording\"",
                    "Unlock to make changes",
                    "Add " + APP + " to the list of allowed apps",
                    "Restart " + APP + " after granting permission"),
            "microphone", List.of(
                    "Open System Settings > Privacy & Security",
                    "Select \"Microphone\"",
                    "Unlock to make changes",
                    "Add " + APP + " to the list of allowed apps"),
            "camera", List.of(
                    "Open System Settings > Privacy & Security",
                    "Select \"Camera\"",
                    "Unlock to make changes",
                    "Add " + APP + " to the list of allowed apps"),
            "files", List.of(
                    "Open System Settings > Privacy & Security",
                    "Select \"Files and Folders\"",
                    "Unlock to make changes",
                    "Allow " + APP + " and select the folders it may access"));

    private static final Map<String, List<String>> WINDOWS = Map.of(
            "accessibility", List.of(
                    "Open Settings > Privacy & Security > Accessibility",
                    "Turn on \"Let apps access your accessibility features\"",
                    "Add " + APP + " to the list of allowed apps"),
            "microphone", List.of(
                    "Open Settings > Privacy & Security > Microphone",
                    "Turn on \"Microphone access\"",
                    "Add " + APP + " to the list of allowed apps"),
            "camera", List.of(
                    "Open Settings > Privacy & Security > Camera",
                    "Turn on \"Camera access\"",
                    "Add " + APP + " to the list of allowed apps"),
            "files", List.of(
                    "Open Settings > Privacy & Security > File System",
                    "Turn on \"File System access\"",
                    "Add " + APP + " to the list of allowed apps"));

    private static final Map<String, List<String>> LINUX = Map.of(
            "microphone", List.of(
                    "Open Settings > Privacy > Microphone",
                    "Turn on microphone access",
                    "Check that your user can read the capture device (audio group)"),
            "screen_recording", List.of(
                    "Open Settings > Privacy > Screen Sharing",
                    "On Wayland, approve the screen capture portal prompt for " + APP,
                    "Or log in to an X11 session"),
            "accessibility", List.of(
                    "Open Settings > Accessibility",
                    "Enable assistive technologies",
                    "Restart " + APP + " after enabling"));

    private PermissionGuides() {
    }

    static List<String> forPlatform(Platform platform, String permissionType) {
        String key = permissionType.trim().toLowerCase(Locale.ROOT);
        return switch (platform) {
            case MAC -> MAC.getOrDefault(key, List.of(
                    "Open System Settings > Privacy & Security",
                    "Look for the relevant permission category",
                    "Add " + APP + " to the allowed apps list"));
            case WINDOWS -> WINDOWS.getOrDefault(key, List.of(
                    "Open Settings > Privacy & Security",
                    "Look for the relevant permission category",
                    "Add " + APP + " to the allowed apps list"));
            case LINUX -> LINUX.getOrDefault(key, genericSteps());
            case OTHER -> genericSteps();
        };
    }

    static String settingsUri(Platform platform, String permissionType) {
        String key = permissionType.trim().toLowerCase(Locale.ROOT);
        return switch (platform) {
            case MAC -> switch (key) {
                case "accessibility" ->
                        "x-apple.systempreferences:com.apple.preference.security?Privacy_Accessibility";
                case "screen_recording" ->
                        "x-apple.systempreferences:com.apple.preference.security?Privacy_ScreenCapture";
                case "microphone" ->
                        "x-apple.systempreferences:com.apple.preference.security?Privacy_Microphone";
                case "camera" -> "x-apple.systempreferences:com.apple.preference.security?Privacy_Camera";
                default -> "x-apple.systempreferences:com.apple.preference.security";
            };
            case WINDOWS -> switch (key) {
                case "microphone" -> "ms-settings:privacy-microphone";
                case "camera" -> "ms-settings:privacy-webcam";
                case "files" -> "ms-settings:privacy-broadfilesystemaccess";
                default -> "ms-settings:privacy";
            };
            case LINUX, OTHER -> null;
        };
    }

    private static List<String> genericSteps() {
        return List.of(
                "Open your system privacy settings",
                "Look for the relevant permission category",
                "Allow " + APP + " and restart it");
    }
}
