package com.phillippitts.ambient.service.fallback;

import com.phillippitts.ambient.service.fallback.event.FallbackIssuedEvent;
import com.phillippitts.ambient.service.metrics.AmbientMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts fallback resolutions and logs failed ones for follow-up.
 */
@Component
class FallbackEventsListener {

    private static final Logger LOG = LogManager.getLogger(FallbackEventsListener.class);

    private final AmbientMetrics metrics;

    FallbackEventsListener(AmbientMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onFallbackIssued(FallbackIssuedEvent e) {
        String reason = e.reason() == null ? "unknown" : e.reason().key();
        metrics.incrementFallback(reason);
        if (!e.response().success()) {
            LOG.info("Unrecoverable action: reason={}, message='{}'", reason, e.response().message());
        }
    }
}
