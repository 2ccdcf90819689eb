package com.phillippitts.ambient.service.fallback.event;

import com.phillippitts.ambient.domain.FallbackReason;
import com.phillippitts.ambient.domain.FallbackResponse;

import java.time.Instant;

/**
 * Published after every fallback resolution.
 *
 * @param reason resolved reason, null when the request carried no recognised reason
 */
public record FallbackIssuedEvent(FallbackReason reason, FallbackResponse response, Instant at) { }
