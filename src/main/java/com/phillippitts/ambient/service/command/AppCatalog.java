package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.service.launch.Platform;
import com.phillippitts.ambient.util.TextSimilarity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Known desktop and web applications with per-platform install locations.
 *
 * <p>Spoken names resolve by exact key or alias first, then by edit-distance similarity at or
 * above {@code ambient.command.fuzzy-threshold}. The match quality feeds into intent confidence.
 */
@Component
public class AppCatalog {

    /**
     * Resolved application.
     *
     * @param app catalog entry
     * @param quality 1.0 for an exact name, otherwise the similarity score
     */
    public record AppMatch(AppDefinition app, double quality) { }

    private static final List<AppDefinition> APPS = List.of(
            new AppDefinition("chrome", "Google Chrome", List.of("google chrome", "chromium", "chrome browser"),
                    Map.of(Platform.MAC, "/Applications/Google Chrome.app",
                            Platform.WINDOWS, "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe",
                            Platform.LINUX, "google-chrome"),
                    null, "https://www.google.com/chrome/"),
            new AppDefinition("firefox", "Firefox", List.of("mozilla firefox", "mozilla"),
                    Map.of(Platform.MAC, "/Applications/Firefox.app",
                            Platform.WINDOWS, "C:\\Program Files\\Mozilla Firefox\\firefox.exe",
                            Platform.LINUX, "firefox"),
                    null, "https://www.mozilla.org/firefox/new/"),
            new AppDefinition("notepad", "Notepad", List.of("text editor", "textedit"),
                    Map.of(Platform.MAC, "/System/Applications/TextEdit.app",
                            Platform.WINDOWS, "notepad.exe",
                            Platform.LINUX, "gedit"),
                    null, null),
            new AppDefinition("calculator", "Calculator", List.of("calc"),
                    Map.of(Platform.MAC, "/System/Applications/Calculator.app",
                            Platform.WINDOWS, "calc.exe",
                            Platform.LINUX, "gnome-calculator"),
                    null, null),
            new AppDefinition("explorer", "File Explorer", List.of("file explorer", "files", "finder", "folder"),
                    Map.of(Platform.MAC, "/System/Library/CoreServices/Finder.app",
                            Platform.WINDOWS, "explorer.exe",
                            Platform.LINUX, "nautilus"),
                    null, null),
            new AppDefinition("vscode", "Visual Studio Code", List.of("vs code", "visual studio code", "code"),
                    Map.of(Platform.MAC, "/Applications/Visual Studio Code.app",
                            Platform.WINDOWS, "%LOCALAPPDATA%\\Programs\\Microsoft VS Code\\Code.exe",
                            Platform.LINUX, "code"),
                    "https://vscode.dev", "https://code.visualstudio.com/download"),
            new AppDefinition("spotify", "Spotify", List.of("music"),
                    Map.of(Platform.MAC, "/Applications/Spotify.app",
                            Platform.WINDOWS, "%APPDATA%\\Spotify\\Spotify.exe",
                            Platform.LINUX, "spotify"),
                    "https://open.spotify.com", "https://www.spotify.com/download/"),
            new AppDefinition("discord", "Discord", List.of(),
                    Map.of(Platform.MAC, "/Applications/Discord.app",
                            Platform.WINDOWS, "%LOCALAPPDATA%\\Discord\\Update.exe",
                            Platform.LINUX, "discord"),
                    "https://discord.com/app", "https://discord.com/download"),
            new AppDefinition("slack", "Slack", List.of(),
                    Map.of(Platform.MAC, "/Applications/Slack.app",
                            Platform.WINDOWS, "%LOCALAPPDATA%\\slack\\slack.exe",
                            Platform.LINUX, "slack"),
                    "https://app.slack.com", "https://slack.com/downloads"),
            new AppDefinition("zoom", "Zoom", List.of("zoom meeting"),
                    Map.of(Platform.MAC, "/Applications/zoom.us.app",
                            Platform.WINDOWS, "%APPDATA%\\Zoom\\bin\\Zoom.exe",
                            Platform.LINUX, "zoom"),
                    null, "https://zoom.us/download"),
            new AppDefinition("figma", "Figma", List.of(), Map.of(), "https://www.figma.com/files", null),
            new AppDefinition("notion", "Notion", List.of("notion app"),
                    Map.of(Platform.MAC, "/Applications/Notion.app",
                            Platform.WINDOWS, "%LOCALAPPDATA%\\Programs\\Notion\\Notion.exe"),
                    null, "https://www.notion.so/desktop")
    );

    private final Platform platform;
    private final double fuzzyThreshold;
    private final Predicate<String> locationExists;

    @Autowired
    public AppCatalog(Platform platform, CommandProperties props) {
        this(platform, props.getFuzzyThreshold(), AppCatalog::defaultLocationExists);
    }

    // Package-private for tests
    AppCatalog(Platform platform, double fuzzyThreshold, Predicate<String> locationExists) {
        this.platform = Objects.requireNonNull(platform);
        this.fuzzyThreshold = fuzzyThreshold;
        this.locationExists = Objects.requireNonNull(locationExists);
    }

    public List<AppDefinition> all() {
        return APPS;
    }

    /**
     * Resolves a spoken application name.
     */
    public Optional<AppMatch> resolve(String spokenName) {
        if (spokenName == null || spokenName.isBlank()) {
            return Optional.empty();
        }
        String name = spokenName.trim().toLowerCase(Locale.ROOT);
        for (AppDefinition app : APPS) {
            if (app.key().equals(name) || app.displayName().toLowerCase(Locale.ROOT).equals(name)
                    || app.aliases().contains(name)) {
                return Optional.of(new AppMatch(app, 1.0));
            }
        }
        AppDefinition best = null;
        double bestScore = 0.0;
        for (AppDefinition app : APPS) {
            for (String candidate : names(app)) {
                double score = TextSimilarity.similarity(name, candidate);
                if (score > bestScore) {
                    bestScore = score;
                    best = app;
                }
            }
        }
        if (best != null && bestScore >= fuzzyThreshold) {
            return Optional.of(new AppMatch(best, bestScore));
        }
        return Optional.empty();
    }

    /**
     * @return location on the current platform, or empty when the app has no desktop build here
     */
    public Optional<String> locationFor(AppDefinition app) {
        return Optional.ofNullable(app.locations().get(platform)).map(AppCatalog::expandEnv);
    }

    public boolean isInstalled(AppDefinition app) {
        return locationFor(app).map(locationExists::test).orElse(false);
    }

    /**
     * Command that starts the app on the current platform.
     */
    public List<String> launchCommand(AppDefinition app) {
        String location = locationFor(app)
                .orElseThrow(() -> new IllegalStateException(app.displayName() + " has no location on " + platform));
        return switch (platform) {
            case MAC -> List.of("open", "-a", location);
            case WINDOWS, LINUX, OTHER -> List.of(location);
        };
    }

    private static List<String> names(AppDefinition app) {
        List<String> names = new ArrayList<>();
        names.add(app.key());
        names.addAll(app.aliases());
        return names;
    }

    private static String expandEnv(String location) {
        String expanded = location;
        for (String var : List.of("LOCALAPPDATA", "APPDATA")) {
            String token = "%" + var + "%";
            if (expanded.contains(token)) {
                String value = System.getenv(var);
                expanded = expanded.replace(token, value != null ? value : "");
            }
        }
        return expanded;
    }

    /**
     * Absolute locations must exist; bare command names must be found on {@code PATH}.
     */
    static boolean defaultLocationExists(String location) {
        if (location.contains("/") || location.contains("\\")) {
            return Files.exists(Path.of(location));
        }
        if (location.endsWith(".exe")) {
            // Windows system tools live under System32, always on PATH
            return true;
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, location))) {
                return true;
            }
        }
        return false;
    }
}
