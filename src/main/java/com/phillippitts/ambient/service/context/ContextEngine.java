package com.phillippitts.ambient.service.context;

import com.phillippitts.ambient.config.properties.ContextProperties;
import com.phillippitts.ambient.domain.AudioSession;
import com.phillippitts.ambient.domain.ContextPattern;
import com.phillippitts.ambient.domain.ContextSnapshot;
import com.phillippitts.ambient.domain.ScreenSnapshot;
import com.phillippitts.ambient.domain.Trigger;
import com.phillippitts.ambient.exception.InvalidPatternException;
import com.phillippitts.ambient.service.audio.event.AudioSessionCompletedEvent;
import com.phillippitts.ambient.service.context.event.ContextTriggerEvent;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.service.screen.event.ScreenSnapshotCapturedEvent;
import com.phillippitts.ambient.service.store.RecordStore;
import com.phillippitts.ambient.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.PatternSyntaxException;

/**
 * Fuses the newest screen and audio state into context snapshots and fires user-defined
 * patterns against them.
 *
 * <p><b>Fusion:</b> {@link #update} keeps the newest screen snapshot and the newest sealed audio
 * session (last writer wins per field) and records a new {@link ContextSnapshot}.
 *
 * <p><b>Matching:</b> {@link #evaluate} returns one {@link Trigger} per matching active pattern;
 * several patterns may fire for the same snapshot. Inside the quiet window no triggers are
 * returned, while snapshots are still recorded.
 *
 * <p><b>Wiring:</b> while running, sentinel events drive update and evaluate, and each trigger is
 * published as a {@link ContextTriggerEvent}. A failure while handling one event is logged and
 * does not affect later events.
 *
 * <p><b>Thread Safety:</b> update, evaluate and pattern registration share one
 * {@link ReentrantLock}; the screen scheduler and the audio thread may call in concurrently.
 */
@Service
public class ContextEngine {

    private static final Logger LOG = LogManager.getLogger(ContextEngine.class);

    private final ContextProperties props;
    private final RecordStore store;
    private final ApplicationEventPublisher publisher;
    private final AmbientMetrics metrics;
    private final Clock clock;
    private final PatternMatcher matcher = new PatternMatcher();
    private final ActivityIntentClassifier classifier = new ActivityIntentClassifier();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ContextPattern> patterns = new LinkedHashMap<>();
    private ScreenSnapshot lastScreen;
    private AudioSession lastAudio;
    private ContextSnapshot current;

    private volatile QuietHours quietHours = QuietHours.NONE;
    private volatile boolean running;

    public ContextEngine(ContextProperties props,
                         RecordStore store,
                         ApplicationEventPublisher publisher,
                         AmbientMetrics metrics,
                         Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.clock = Objects.requireNonNull(clock);
    }

    @PostConstruct
    void applyConfiguration() {
        quietHours = new QuietHours(props.getQuietHoursStart(), props.getQuietHoursEnd());
        for (ContextPattern p : props.getPatterns()) {
            addContextPattern(p);
        }
        LOG.info("Context engine configured: patterns={}, quietHours={}", patterns.size(), describe(quietHours));
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        LOG.info("Context engine started");
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOG.info("Context engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Merges the given state into a new context snapshot. A null argument keeps the previous value.
     *
     * @return the recorded snapshot
     */
    public ContextSnapshot update(ScreenSnapshot screen, AudioSession audio) {
        lock.lock();
        try {
            if (screen != null) {
                lastScreen = screen;
            }
            if (audio != null) {
                lastAudio = audio;
            }
            String app = lastScreen == null ? null : lastScreen.appName();
            String title = lastScreen == null ? null : lastScreen.windowTitle();
            ContextSnapshot snapshot = new ContextSnapshot(
                    UUID.randomUUID(),
                    app,
                    title,
                    lastScreen,
                    lastAudio,
                    classifier.classify(app, title,
                            lastScreen == null ? null : lastScreen.extractedText(),
                            lastAudio == null ? null : lastAudio.transcript()),
                    clock.instant(),
                    isQuietHours());
            current = snapshot;
            store.save(snapshot);
            LOG.debug("Context updated: app={}, intent={}, quiet={}", app,
                    snapshot.userIntent() == null ? "none" : snapshot.userIntent().type(), snapshot.quietHours());
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Evaluates all active patterns against a snapshot.
     *
     * @return one trigger per matching pattern in registration order; empty during quiet hours
     */
    public List<Trigger> evaluate(ContextSnapshot snapshot) {
        if (snapshot == null) {
            return List.of();
        }
        lock.lock();
        try {
            if (isQuietHours()) {
                metrics.incrementQuietHoursSuppressed();
                LOG.debug("Quiet hours active; suppressing triggers for snapshot {}", snapshot.id());
                return List.of();
            }
            List<Trigger> triggers = new ArrayList<>();
            for (ContextPattern p : patterns.values()) {
                if (p.isActive() && matcher.matches(p, snapshot)) {
                    triggers.add(new Trigger(p.patternName(), p.triggerActions(), snapshot.id(), clock.instant()));
                }
            }
            return triggers;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a pattern.
     *
     * @throws InvalidPatternException if the name is blank or taken, the window pattern is not a
     *         valid regular expression, or there are no trigger actions
     */
    public void addContextPattern(ContextPattern pattern) {
        if (pattern == null || pattern.patternName() == null || pattern.patternName().isBlank()) {
            throw new InvalidPatternException("patternName", "Context pattern requires a non-blank patternName");
        }
        if (pattern.triggerActions().isEmpty()
                || pattern.triggerActions().stream().anyMatch(a -> a == null || a.isBlank())) {
            throw new InvalidPatternException("triggerActions",
                    "Context pattern '" + pattern.patternName() + "' requires non-blank trigger actions");
        }
        if (pattern.windowPattern() != null && !pattern.windowPattern().isBlank()) {
            try {
                PatternMatcher.compile(pattern.windowPattern());
            } catch (PatternSyntaxException e) {
                throw new InvalidPatternException("windowPattern",
                        "Invalid windowPattern for '" + pattern.patternName() + "': " + e.getDescription(), e);
            }
        }
        lock.lock();
        try {
            String key = key(pattern.patternName());
            if (patterns.containsKey(key)) {
                throw new InvalidPatternException("patternName",
                        "Context pattern '" + pattern.patternName() + "' already exists");
            }
            patterns.put(key, pattern);
        } finally {
            lock.unlock();
        }
        LOG.info("Context pattern registered: name={}, app={}, active={}, actions={}",
                pattern.patternName(), pattern.appName(), pattern.isActive(), pattern.triggerActions().size());
    }

    public boolean removeContextPattern(String patternName) {
        if (patternName == null) {
            return false;
        }
        lock.lock();
        try {
            return patterns.remove(key(patternName)) != null;
        } finally {
            lock.unlock();
        }
    }

    /** Registered patterns in registration order. */
    public List<ContextPattern> listPatterns() {
        lock.lock();
        try {
            return List.copyOf(patterns.values());
        } finally {
            lock.unlock();
        }
    }

    public void setQuietHours(int startHour, int endHour) {
        quietHours = new QuietHours(startHour, endHour);
        LOG.info("Quiet hours set to {}", describe(quietHours));
    }

    public void clearQuietHours() {
        quietHours = QuietHours.NONE;
        LOG.info("Quiet hours cleared");
    }

    public QuietHours getQuietHours() {
        return quietHours;
    }

    public boolean isQuietHours() {
        return quietHours.contains(LocalTime.now(clock));
    }

    public Optional<ContextSnapshot> currentSnapshot() {
        lock.lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.unlock();
        }
    }

    public List<ContextSnapshot> recentSnapshots(int limit) {
        return store.latest(ContextSnapshot.class, limit);
    }

    public ContextStatus status() {
        lock.lock();
        try {
            int active = (int) patterns.values().stream().filter(ContextPattern::isActive).count();
            return new ContextStatus(running, patterns.size(), active, quietHours, isQuietHours(), current);
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    void onScreenSnapshot(ScreenSnapshotCapturedEvent event) {
        if (running) {
            process(event.snapshot(), null);
        }
    }

    @EventListener
    void onAudioSession(AudioSessionCompletedEvent event) {
        if (running) {
            process(null, event.session());
        }
    }

    private void process(ScreenSnapshot screen, AudioSession audio) {
        List<Trigger> triggers;
        lock.lock();
        try {
            triggers = evaluate(update(screen, audio));
        } catch (RuntimeException e) {
            LOG.warn("Context update failed; input dropped: {}", e.toString());
            return;
        } finally {
            lock.unlock();
        }
        for (Trigger t : triggers) {
            metrics.incrementTrigger(t.patternName());
            LOG.info("Pattern fired: name={}, actions={}", t.patternName(),
                    LogSanitizer.truncate(String.join(", ", t.triggerActions()), 80));
            publisher.publishEvent(new ContextTriggerEvent(t));
        }
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static String describe(QuietHours q) {
        return q.isEnabled() ? q.startHour() + ":00-" + q.endHour() + ":00" : "off";
    }
}
