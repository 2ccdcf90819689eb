package com.phillippitts.ambient.service.health;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.screen.ScreenSentinel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SentinelHealthIndicatorTest {

    private ScreenSentinel screen;
    private AudioSentinel audio;
    private ContextEngine context;
    private AmbientProperties props;
    private SentinelHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        screen = mock(ScreenSentinel.class);
        audio = mock(AudioSentinel.class);
        context = mock(ContextEngine.class);
        props = new AmbientProperties();
        when(audio.state()).thenReturn(AudioSentinel.State.IDLE);
        indicator = new SentinelHealthIndicator(screen, audio, context, props);
    }

    @Test
    void shouldReportUpWhenAllRunning() {
        when(screen.isRunning()).thenReturn(true);
        when(audio.isRunning()).thenReturn(true);
        when(context.isRunning()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("screen", "running")
                .containsEntry("audio", "running")
                .containsEntry("context", "running")
                .containsEntry("audioState", "IDLE");
    }

    @Test
    void shouldReportUpWhenStoppedWithoutErrors() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("audio", "stopped");
    }

    @Test
    void shouldReportDegradedAfterCaptureError() {
        Instant at = Instant.parse("2024-03-04T10:00:00Z");
        indicator.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", at));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails())
                .containsEntry("captureError", "MIC_UNAVAILABLE")
                .containsEntry("captureErrorAt", "2024-03-04T10:00:00Z");
    }

    @Test
    void shouldIgnoreCaptureErrorOnceAudioRecovers() {
        indicator.onCaptureError(new CaptureErrorEvent("MIC_UNAVAILABLE", Instant.now()));
        when(audio.isRunning()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).doesNotContainKey("captureError");
    }

    @Test
    void shouldReportSentinelsDisabledInUltraLightweightMode() {
        props.setUltraLightweight(true);

        Health health = indicator.health();

        assertThat(health.getDetails())
                .containsEntry("screen", "disabled")
                .containsEntry("audio", "disabled");
    }
}
