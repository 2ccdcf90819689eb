package com.phillippitts.ambient.domain;

import java.time.Instant;

/** One executed (or attempted) command. */
public record CommandHistoryEntry(String command, boolean success, Instant timestamp, String resultSummary) {
}
