package com.phillippitts.ambient.service.screen;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.config.properties.ScreenProperties;
import com.phillippitts.ambient.domain.ScreenSnapshot;
import com.phillippitts.ambient.service.events.SensingFailureEvent;
import com.phillippitts.ambient.service.filter.FilterStore;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import com.phillippitts.ambient.service.screen.event.ScreenSnapshotCapturedEvent;
import com.phillippitts.ambient.service.store.RecordStore;
import com.phillippitts.ambient.util.LogSanitizer;
import com.phillippitts.ambient.util.TextSimilarity;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically samples the foreground window and emits a {@link ScreenSnapshot} when its content
 * changed since the previous snapshot for the same app.
 *
 * <p>Per tick: probe the foreground window, skip filtered apps before reading any content,
 * extract text, fingerprint title and text, and compare with the last fingerprint for that app.
 * An unchanged fingerprint emits nothing. With {@code ambient.screen.min-change-ratio > 0} a
 * changed fingerprint is also dropped when too few words changed.
 *
 * <p>Probe and extractor failures are logged, counted and published as
 * {@link SensingFailureEvent}; the schedule keeps running.
 */
@Service
public class ScreenSentinel {

    private static final Logger LOG = LogManager.getLogger(ScreenSentinel.class);
    private static final String SENTINEL = "screen";

    private final ForegroundWindowProbe probe;
    private final TextExtractor extractor;
    private final FilterStore filters;
    private final ScreenProperties props;
    private final AmbientProperties ambient;
    private final RecordStore store;
    private final ApplicationEventPublisher publisher;
    private final AmbientMetrics metrics;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, String> lastHashByApp = new HashMap<>();
    private final Map<String, String> lastTextByApp = new HashMap<>();
    private ScheduledFuture<?> task;

    public ScreenSentinel(ForegroundWindowProbe probe,
                          TextExtractor extractor,
                          FilterStore filters,
                          ScreenProperties props,
                          AmbientProperties ambient,
                          RecordStore store,
                          ApplicationEventPublisher publisher,
                          AmbientMetrics metrics,
                          @Qualifier("sentinelScheduler") TaskScheduler scheduler,
                          Clock clock) {
        this.probe = Objects.requireNonNull(probe);
        this.extractor = Objects.requireNonNull(extractor);
        this.filters = Objects.requireNonNull(filters);
        this.props = Objects.requireNonNull(props);
        this.ambient = Objects.requireNonNull(ambient);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Starts fixed-rate sampling. Idempotent; a no-op in ultra-lightweight mode.
     */
    public synchronized void start() {
        if (ambient.isUltraLightweight()) {
            LOG.info("Ultra-lightweight mode: screen sampling disabled");
            return;
        }
        if (task != null) {
            return;
        }
        task = scheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(props.getSampleIntervalMs()));
        LOG.info("Screen sentinel started: interval={}ms, minChangeRatio={}",
                props.getSampleIntervalMs(), props.getMinChangeRatio());
    }

    /**
     * Cancels sampling. Idempotent.
     */
    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        LOG.info("Screen sentinel stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    void tick() {
        ThreadContext.put("sentinel", SENTINEL);
        try {
            sample();
        } finally {
            ThreadContext.remove("sentinel");
        }
    }

    /**
     * Performs one sampling pass.
     *
     * @return the new snapshot, or empty when nothing changed, the app is filtered, or sensing failed
     */
    public synchronized Optional<ScreenSnapshot> sample() {
        ForegroundWindow window;
        try {
            window = probe.probe();
        } catch (RuntimeException e) {
            return failed("PROBE_FAILED", e);
        }
        if (window == null || window.appName().isEmpty()) {
            metrics.recordScreenSample("idle");
            return Optional.empty();
        }
        if (!filters.isAppAllowed(window.appName(), window.windowTitle())) {
            metrics.recordScreenSample("filtered");
            LOG.debug("Skipping filtered app: {}", window.appName());
            return Optional.empty();
        }

        String text;
        try {
            text = extractor.extract(window);
        } catch (RuntimeException e) {
            return failed("EXTRACTION_FAILED", e);
        }
        text = text == null ? "" : text;

        String appKey = window.appName().toLowerCase(Locale.ROOT);
        String hash = ContentFingerprint.of(window.windowTitle(), text);
        if (hash.equals(lastHashByApp.get(appKey))) {
            metrics.recordScreenSample("unchanged");
            return Optional.empty();
        }
        String previousText = lastTextByApp.get(appKey);
        if (props.getMinChangeRatio() > 0.0 && previousText != null
                && TextSimilarity.jaccard(previousText, text) > 1.0 - props.getMinChangeRatio()) {
            metrics.recordScreenSample("insignificant");
            return Optional.empty();
        }

        ScreenSnapshot snapshot = new ScreenSnapshot(UUID.randomUUID(), window.appName(), window.windowTitle(),
                text, hash, clock.instant());
        lastHashByApp.put(appKey, hash);
        lastTextByApp.put(appKey, text);
        store.save(snapshot);
        metrics.recordScreenSample("emitted");
        LOG.debug("Screen snapshot: app={}, chars={}, preview='{}'",
                snapshot.appName(), text.length(), LogSanitizer.preview(text));
        publisher.publishEvent(new ScreenSnapshotCapturedEvent(snapshot));
        return Optional.of(snapshot);
    }

    public List<ScreenSnapshot> recentSnapshots(int limit) {
        return store.latest(ScreenSnapshot.class, limit);
    }

    private Optional<ScreenSnapshot> failed(String reason, RuntimeException e) {
        metrics.recordScreenSample("failed");
        LOG.debug("Screen sampling failed: reason={}, error={}", reason, e.toString());
        publisher.publishEvent(new SensingFailureEvent(SENTINEL, reason, Instant.now(clock)));
        return Optional.empty();
    }
}
