package com.phillippitts.ambient.service.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AmbientMetricsTest {

    private SimpleMeterRegistry registry;
    private AmbientMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AmbientMetrics(registry);
    }

    @Test
    void shouldCountSamplesAndSessionsByOutcome() {
        metrics.recordScreenSample("emitted");
        metrics.recordScreenSample("emitted");
        metrics.recordScreenSample("unchanged");
        metrics.recordAudioSession("too_short");

        assertThat(registry.counter("ambient.screen.samples", "outcome", "emitted").count()).isEqualTo(2.0);
        assertThat(registry.counter("ambient.screen.samples", "outcome", "unchanged").count()).isEqualTo(1.0);
        assertThat(registry.counter("ambient.audio.sessions", "outcome", "too_short").count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountTriggersPerPattern() {
        metrics.incrementTrigger("focus");
        metrics.incrementTrigger("focus");
        metrics.incrementQuietHoursSuppressed();

        assertThat(registry.counter("ambient.context.triggers", "pattern", "focus").count()).isEqualTo(2.0);
        assertThat(registry.counter("ambient.context.suppressed").count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordCommandLatencyWithTags() {
        metrics.recordCommand("search", "exact", true, TimeUnit.MILLISECONDS.toNanos(40));
        metrics.recordCommand("search", "exact", true, TimeUnit.MILLISECONDS.toNanos(60));

        Timer timer = registry.find("ambient.command.latency")
                .tags("category", "search", "strategy", "exact", "success", "true")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
    }

    @Test
    void shouldCountClarifierAndFallbackOutcomes() {
        metrics.recordClarifier("timeout");
        metrics.incrementFallback("missing_app");

        assertThat(registry.counter("ambient.command.clarifier", "outcome", "timeout").count()).isEqualTo(1.0);
        assertThat(registry.counter("ambient.fallback.resolutions", "reason", "missing_app").count())
                .isEqualTo(1.0);
    }
}
