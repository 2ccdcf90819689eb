package com.phillippitts.ambient.service.context;

import com.phillippitts.ambient.domain.ContextSnapshot;

/**
 * Point-in-time view of the context engine for status endpoints and health checks.
 */
public record ContextStatus(boolean running,
                            int patternCount,
                            int activePatternCount,
                            QuietHours quietHours,
                            boolean quietNow,
                            ContextSnapshot current) { }
