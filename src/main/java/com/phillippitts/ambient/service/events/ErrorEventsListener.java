package com.phillippitts.ambient.service.events;

import com.phillippitts.ambient.service.audio.event.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam
 * while a sentinel keeps failing on every tick.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Audio capture error: reason={}. Check microphone device & permissions.", e.reason());
        }
    }

    @EventListener
    void onSensingFailure(SensingFailureEvent e) {
        String key = "sensing-" + e.sentinel() + '-' + e.reason();
        if (shouldLog(key)) {
            if ("screen".equals(e.sentinel())) {
                LOG.warn("Screen sensing failing: reason={}. On macOS grant Screen Recording and Accessibility: "
                        + "System Settings → Privacy & Security", e.reason());
            } else {
                LOG.warn("Sensing failure: sentinel={}, reason={}", e.sentinel(), e.reason());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
