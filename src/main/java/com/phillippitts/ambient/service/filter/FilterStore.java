package com.phillippitts.ambient.service.filter;

import com.phillippitts.ambient.domain.AppFilter;
import com.phillippitts.ambient.domain.AudioFilter;
import com.phillippitts.ambient.exception.InvalidFilterException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the user's app and audio-source filters and answers "may this be sensed?".
 *
 * <p>Precedence: a blacklisted entry is never sensed. While any whitelist entry exists,
 * only whitelisted entries are sensed; a whitelisted app with window patterns is sensed only
 * when the window title contains one of them. Without whitelist entries everything that is
 * not blacklisted is sensed. An entry flagged both ways counts as blacklisted.
 *
 * <p>Names compare case-insensitively. Registering a filter for a name replaces the previous one.
 */
@Service
public class FilterStore {

    private static final Logger LOG = LogManager.getLogger(FilterStore.class);

    private final Map<String, AppFilter> appFilters = new ConcurrentHashMap<>();
    private final Map<String, AudioFilter> audioFilters = new ConcurrentHashMap<>();

    /**
     * Registers an app filter.
     *
     * @throws InvalidFilterException if the app name or a window pattern is blank
     */
    public void addAppFilter(AppFilter filter) {
        if (filter == null || isBlank(filter.appName())) {
            throw new InvalidFilterException("appName", "App filter requires a non-blank appName");
        }
        for (String p : filter.windowPatterns()) {
            if (isBlank(p)) {
                throw new InvalidFilterException("windowPatterns",
                        "Window patterns must not be blank for app '" + filter.appName() + "'");
            }
        }
        warnIfConflicting(filter.appName(), filter.whitelisted(), filter.blacklisted());
        appFilters.put(key(filter.appName()), filter);
        LOG.info("App filter registered: app={}, whitelisted={}, blacklisted={}, windowPatterns={}",
                filter.appName(), filter.whitelisted(), filter.blacklisted(), filter.windowPatterns().size());
    }

    /**
     * Registers an audio-source filter.
     *
     * @throws InvalidFilterException if the source name is blank or the threshold is outside [0,1]
     */
    public void addAudioFilter(AudioFilter filter) {
        if (filter == null || isBlank(filter.sourceName())) {
            throw new InvalidFilterException("sourceName", "Audio filter requires a non-blank sourceName");
        }
        Double threshold = filter.volumeThreshold();
        if (threshold != null && (threshold.isNaN() || threshold < 0.0 || threshold > 1.0)) {
            throw new InvalidFilterException("volumeThreshold",
                    "volumeThreshold must be within [0,1], got " + threshold);
        }
        warnIfConflicting(filter.sourceName(), filter.whitelisted(), filter.blacklisted());
        audioFilters.put(key(filter.sourceName()), filter);
        LOG.info("Audio filter registered: source={}, whitelisted={}, blacklisted={}, threshold={}",
                filter.sourceName(), filter.whitelisted(), filter.blacklisted(), threshold);
    }

    public boolean removeAppFilter(String appName) {
        return appName != null && appFilters.remove(key(appName)) != null;
    }

    public boolean removeAudioFilter(String sourceName) {
        return sourceName != null && audioFilters.remove(key(sourceName)) != null;
    }

    public boolean isAppAllowed(String appName, String windowTitle) {
        AppFilter filter = appName == null ? null : appFilters.get(key(appName));
        if (filter != null && filter.blacklisted()) {
            return false;
        }
        boolean whitelistActive = appFilters.values().stream().anyMatch(f -> f.whitelisted() && !f.blacklisted());
        if (!whitelistActive) {
            return true;
        }
        if (filter == null || !filter.whitelisted()) {
            return false;
        }
        if (filter.windowPatterns().isEmpty()) {
            return true;
        }
        String title = windowTitle == null ? "" : windowTitle.toLowerCase(Locale.ROOT);
        return filter.windowPatterns().stream().anyMatch(p -> title.contains(p.toLowerCase(Locale.ROOT)));
    }

    public boolean isAudioSourceAllowed(String sourceName) {
        AudioFilter filter = sourceName == null ? null : audioFilters.get(key(sourceName));
        if (filter != null && filter.blacklisted()) {
            return false;
        }
        boolean whitelistActive = audioFilters.values().stream().anyMatch(f -> f.whitelisted() && !f.blacklisted());
        if (!whitelistActive) {
            return true;
        }
        return filter != null && filter.whitelisted();
    }

    /**
     * Speech threshold for a source, or {@code defaultThreshold} when the source has no
     * filter or its filter leaves the threshold unset.
     */
    public double volumeThresholdFor(String sourceName, double defaultThreshold) {
        AudioFilter filter = sourceName == null ? null : audioFilters.get(key(sourceName));
        if (filter == null || filter.volumeThreshold() == null) {
            return defaultThreshold;
        }
        return filter.volumeThreshold();
    }

    /**
     * True when the source has no keyword gate or the transcript mentions one of its keywords.
     */
    public boolean matchesAudioKeywords(String sourceName, String transcript) {
        AudioFilter filter = sourceName == null ? null : audioFilters.get(key(sourceName));
        if (filter == null || filter.keywords().isEmpty()) {
            return true;
        }
        String text = transcript == null ? "" : transcript.toLowerCase(Locale.ROOT);
        return filter.keywords().stream()
                .filter(k -> !isBlank(k))
                .anyMatch(k -> text.contains(k.toLowerCase(Locale.ROOT)));
    }

    public List<AppFilter> listAppFilters() {
        return List.copyOf(appFilters.values());
    }

    public List<AudioFilter> listAudioFilters() {
        return List.copyOf(audioFilters.values());
    }

    private static void warnIfConflicting(String name, boolean whitelisted, boolean blacklisted) {
        if (whitelisted && blacklisted) {
            LOG.warn("Filter for '{}' is both whitelisted and blacklisted; treating it as blacklisted", name);
        }
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
