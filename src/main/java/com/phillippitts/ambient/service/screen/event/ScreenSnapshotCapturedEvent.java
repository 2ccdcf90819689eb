package com.phillippitts.ambient.service.screen.event;

import com.phillippitts.ambient.domain.ScreenSnapshot;

/**
 * Published when a sampling tick produced new screen content.
 */
public record ScreenSnapshotCapturedEvent(ScreenSnapshot snapshot) { }
