package com.phillippitts.ambient.service.fallback;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.domain.FallbackAction;
import com.phillippitts.ambient.domain.FallbackDetails;
import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackRequest;
import com.phillippitts.ambient.domain.FallbackResponse;
import com.phillippitts.ambient.service.fallback.event.FallbackIssuedEvent;
import com.phillippitts.ambient.service.launch.ExternalLauncher;
import com.phillippitts.ambient.service.launch.Platform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an unsatisfiable action into structured recovery guidance.
 *
 * <p>Every reason yields a response with a human-readable message and, where there is something
 * the user can do, ordered next steps. The resolver never throws; a request without a usable
 * reason is answered with a generic failure. Opening a store, OAuth or settings page is the only
 * side effect and is best-effort: opener failures are logged and do not change the response.
 */
@Service
public class FallbackResolver {

    private static final Logger LOG = LogManager.getLogger(FallbackResolver.class);

    static final String MAC_APP_STORE_SEARCH =
            "macappstore://search.itunes.apple.com/WebObjects/MZSearch.woa/wa/search?media=software&term=";
    static final String MS_STORE_SEARCH = "ms-windows-store://search/?query=";
    static final String FLATHUB_SEARCH = "https://flathub.org/apps/search?q=";

    private static final Map<String, String> OAUTH_URLS = Map.of(
            "google", "https://accounts.google.com/o/oauth2/v2/auth",
            "microsoft", "https://login.microsoftonline.com/common/oauth2/v2.0/authorize",
            "github", "https://github.com/login/oauth/authorize",
            "slack", "https://slack.com/oauth/v2/authorize",
            "discord", "https://discord.com/api/oauth2/authorize",
            "zoom", "https://zoom.us/oauth/authorize",
            "dropbox", "https://www.dropbox.com/oauth2/authorize",
            "box", "https://account.box.com/api/oauth2/authorize");

    private final Platform platform;
    private final ExternalLauncher launcher;
    private final AmbientProperties props;
    private final ApplicationEventPublisher publisher;

    public FallbackResolver(Platform platform,
                            ExternalLauncher launcher,
                            AmbientProperties props,
                            ApplicationEventPublisher publisher) {
        this.platform = Objects.requireNonNull(platform);
        this.launcher = Objects.requireNonNull(launcher);
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
    }

    /**
     * Resolves a fallback request.
     *
     * @param request request, may be null
     * @return guidance, never null
     */
    public FallbackResponse resolve(FallbackRequest request) {
        FallbackResponse response;
        FallbackReason reason = request == null ? null : request.reason();
        if (reason == null) {
            response = new FallbackResponse(false, "Unknown fallback reason", FallbackAction.MANUAL_INSTRUCTION,
                    List.of());
        } else {
            FallbackDetails details = request.details();
            response = switch (reason) {
                case MISSING_APP -> missingApp(details);
                case MISSING_OAUTH -> missingOAuth(details);
                case MISSING_PERMISSION -> missingPermission(details);
                case MISSING_SCRIPT -> missingScript(details);
                case UNKNOWN_ACTION -> unknownAction(details);
            };
        }
        LOG.info("Fallback resolved: reason={}, success={}, action={}, steps={}",
                reason == null ? "unknown" : reason.key(), response.success(),
                response.action() == null ? "none" : response.action().key(), response.nextSteps().size());
        publisher.publishEvent(new FallbackIssuedEvent(reason, response, Instant.now()));
        return response;
    }

    private FallbackResponse missingApp(FallbackDetails details) {
        String appName = details.appName();
        if (isBlank(appName)) {
            return new FallbackResponse(false, "App name not specified in fallback request",
                    FallbackAction.MANUAL_INSTRUCTION, List.of());
        }
        String appUrl = details.appUrl();
        List<String> steps = new ArrayList<>();
        String storeUri;
        switch (platform) {
            case MAC -> {
                if (!isBlank(appUrl)) {
                    steps.add("Open browser to download: " + appUrl);
                    steps.add("Or install from the Mac App Store if available");
                } else {
                    steps.add("Search for " + appName + " in the Mac App Store");
                    steps.add("Or download it from the official website");
                }
                storeUri = MAC_APP_STORE_SEARCH + encode(appName);
            }
            case WINDOWS -> {
                if (!isBlank(appUrl)) {
                    steps.add("Open browser to download: " + appUrl);
                } else {
                    steps.add("Search for " + appName + " in the Microsoft Store");
                    steps.add("Or download it from the official website");
                }
                storeUri = MS_STORE_SEARCH + encode(appName);
            }
            case LINUX -> {
                if (!isBlank(appUrl)) {
                    steps.add("Open browser to download: " + appUrl);
                }
                steps.add("Search for " + appName + " on Flathub or in your package manager");
                storeUri = FLATHUB_SEARCH + encode(appName);
            }
            default -> {
                steps.add(isBlank(appUrl)
                        ? "Download " + appName + " from the official website"
                        : "Open browser to download: " + appUrl);
                storeUri = null;
            }
        }
        openBestEffort(isBlank(appUrl) ? storeUri : appUrl);
        return new FallbackResponse(true,
                "App \"" + appName + "\" is not installed. Install it and try again.",
                FallbackAction.INSTALL_APP, steps);
    }

    private FallbackResponse missingOAuth(FallbackDetails details) {
        String provider = details.oauthProvider();
        if (isBlank(provider)) {
            return new FallbackResponse(false, "OAuth provider not specified in fallback request",
                    FallbackAction.MANUAL_INSTRUCTION, List.of());
        }
        String url = OAUTH_URLS.get(provider.trim().toLowerCase(Locale.ROOT));
        List<String> steps = new ArrayList<>();
        if (url != null) {
            steps.add("Open the OAuth authorization page for " + provider);
            steps.add("Complete the authorization flow");
            steps.add("Copy the authorization code or token");
            steps.add("Configure the token in the assistant settings");
            openBestEffort(url);
        } else {
            steps.add("Search for " + provider + " OAuth documentation");
            steps.add("Follow the official OAuth setup guide");
        }
        return new FallbackResponse(true,
                "OAuth token for " + provider + " is required. Please complete the authorization flow.",
                FallbackAction.OPEN_OAUTH, steps);
    }

    private FallbackResponse missingPermission(FallbackDetails details) {
        String permission = details.permissionType();
        if (isBlank(permission)) {
            return new FallbackResponse(false, "Permission type not specified in fallback request",
                    FallbackAction.MANUAL_INSTRUCTION, List.of());
        }
        openBestEffort(PermissionGuides.settingsUri(platform, permission));
        return new FallbackResponse(true,
                permission + " permission is required for this feature. Please grant it in system settings.",
                FallbackAction.REQUEST_PERMISSION, PermissionGuides.forPlatform(platform, permission));
    }

    private FallbackResponse missingScript(FallbackDetails details) {
        String action = details.action();
        List<String> steps = new ArrayList<>(List.of(
                "Analyze the requested action",
                "Generate an automation script for it",
                "Test the generated script for safety",
                "Cache it for future use",
                "If the script requires an app, offer to install it"));
        String lower = action == null ? "" : action.toLowerCase(Locale.ROOT);
        if (lower.contains("calendar") || lower.contains("event")) {
            steps.add("Set up calendar integration if not already configured");
            steps.add("Grant calendar permissions if needed");
        }
        if (lower.contains("email") || lower.contains("mail")) {
            steps.add("Set up mail integration if not already configured");
            steps.add("Configure email accounts if needed");
        }
        return new FallbackResponse(true,
                "A script will be generated for: " + (isBlank(action) ? "unknown action" : action)
                        + ". This may require installing or configuring apps.",
                FallbackAction.GENERATE_SCRIPT, steps);
    }

    private FallbackResponse unknownAction(FallbackDetails details) {
        String action = details.action();
        return new FallbackResponse(false,
                "Unknown action requested: " + (isBlank(action) ? "unspecified" : action)
                        + ". The assistant cannot perform this action.",
                FallbackAction.MANUAL_INSTRUCTION,
                List.of("Try rephrasing your request",
                        "Break down complex actions into simpler steps",
                        "Check if the required app is installed",
                        "Verify that necessary permissions are granted"));
    }

    private void openBestEffort(String uri) {
        if (uri == null || !props.getFallback().isOpenLinks()) {
            return;
        }
        try {
            launcher.openUri(uri);
        } catch (RuntimeException e) {
            LOG.warn("Could not open fallback link (scheme={}): {}", scheme(uri), e.toString());
        }
    }

    private static String scheme(String uri) {
        int idx = uri.indexOf(':');
        return idx > 0 ? uri.substring(0, idx) : "?";
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
