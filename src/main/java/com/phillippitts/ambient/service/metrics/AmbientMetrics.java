package com.phillippitts.ambient.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the perception, context, command and fallback pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Screen sampling ticks by outcome (emitted, unchanged, filtered, failed)</li>
 *   <li>Audio sessions by outcome (emitted, discarded, partial)</li>
 *   <li>Context triggers per pattern</li>
 *   <li>Command latency and success by category and routing strategy</li>
 *   <li>Fallback resolutions per reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class AmbientMetrics {

    private static final String METRIC_PREFIX = "ambient";

    private final MeterRegistry registry;

    public AmbientMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome emitted, unchanged, insignificant, filtered or failed
     */
    public void recordScreenSample(String outcome) {
        Counter.builder(METRIC_PREFIX + ".screen.samples")
                .description("Screen sampling ticks by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome emitted, partial, too_short, empty or keyword_miss
     */
    public void recordAudioSession(String outcome) {
        Counter.builder(METRIC_PREFIX + ".audio.sessions")
                .description("Audio sessions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementTrigger(String patternName) {
        Counter.builder(METRIC_PREFIX + ".context.triggers")
                .description("Context pattern firings")
                .tag("pattern", patternName)
                .register(registry)
                .increment();
    }

    public void incrementQuietHoursSuppressed() {
        Counter.builder(METRIC_PREFIX + ".context.suppressed")
                .description("Evaluations suppressed by quiet hours")
                .register(registry)
                .increment();
    }

    /**
     * Records one executed command.
     *
     * @param category intent category key
     * @param strategy routing strategy that matched
     * @param success whether the handler succeeded
     * @param durationNanos handler duration in nanoseconds
     */
    public void recordCommand(String category, String strategy, boolean success, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".command.latency")
                .description("Time taken to route and execute a command")
                .tag("category", category)
                .tag("strategy", strategy)
                .tag("success", Boolean.toString(success))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome proposed, timeout, failed or empty
     */
    public void recordClarifier(String outcome) {
        Counter.builder(METRIC_PREFIX + ".command.clarifier")
                .description("Clarifier round-trips by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String reason) {
        Counter.builder(METRIC_PREFIX + ".fallback.resolutions")
                .description("Fallback resolutions by reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
