package com.phillippitts.ambient.service.events;

import java.time.Instant;

/**
 * Published when a sentinel recovers from a transient failure (probe, extractor or
 * transcriber error). Payload is a short reason; never screen text or transcripts.
 *
 * @param sentinel {@code screen} or {@code audio}
 * @param reason short machine-readable reason, e.g. {@code EXTRACTION_FAILED}
 */
public record SensingFailureEvent(String sentinel, String reason, Instant at) { }
