package com.phillippitts.ambient.service.health;

import com.phillippitts.ambient.config.properties.AmbientProperties;
import com.phillippitts.ambient.service.audio.AudioSentinel;
import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import com.phillippitts.ambient.service.context.ContextEngine;
import com.phillippitts.ambient.service.screen.ScreenSentinel;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the perception pipeline.
 *
 * <ul>
 *   <li>UP: no capture error since audio last started (stopped sentinels are not a failure)</li>
 *   <li>DEGRADED: audio capture failed and the audio sentinel is not running</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SentinelHealthIndicator implements HealthIndicator {

    private final ScreenSentinel screen;
    private final AudioSentinel audio;
    private final ContextEngine context;
    private final AmbientProperties props;

    private volatile CaptureErrorEvent lastCaptureError;

    public SentinelHealthIndicator(ScreenSentinel screen,
                                   AudioSentinel audio,
                                   ContextEngine context,
                                   AmbientProperties props) {
        this.screen = screen;
        this.audio = audio;
        this.context = context;
        this.props = props;
    }

    @EventListener
    public void onCaptureError(CaptureErrorEvent event) {
        lastCaptureError = event;
    }

    @Override
    public Health health() {
        boolean audioRunning = audio.isRunning();
        CaptureErrorEvent error = audioRunning ? null : lastCaptureError;

        Health.Builder builder = error == null ? new Health.Builder().up() : new Health.Builder().status("DEGRADED");
        builder.withDetail("screen", describe(screen.isRunning()))
                .withDetail("audio", describe(audioRunning))
                .withDetail("audioState", audio.state().name())
                .withDetail("context", context.isRunning() ? "running" : "stopped");
        if (error != null) {
            builder.withDetail("captureError", error.reason())
                    .withDetail("captureErrorAt", error.at().toString());
        }
        return builder.build();
    }

    private String describe(boolean running) {
        if (props.isUltraLightweight()) {
            return "disabled";
        }
        return running ? "running" : "stopped";
    }
}
