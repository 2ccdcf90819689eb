package com.phillippitts.ambient.service.context;

import com.phillippitts.ambient.exception.ConfigurationValidationException;

import java.time.LocalTime;

/**
 * Daily quiet window {@code [startHour, endHour)} in local clock hours.
 *
 * <p>{@code startHour > endHour} wraps past midnight (22..7 covers 22:00-06:59).
 * {@code startHour == endHour} is an empty window.
 */
public record QuietHours(int startHour, int endHour) {

    public static final QuietHours NONE = new QuietHours(0, 0);

    public QuietHours {
        if (startHour < 0 || startHour > 23) {
            throw new ConfigurationValidationException("startHour", "startHour must be within 0..23, got " + startHour);
        }
        if (endHour < 0 || endHour > 23) {
            throw new ConfigurationValidationException("endHour", "endHour must be within 0..23, got " + endHour);
        }
    }

    public boolean isEnabled() {
        return startHour != endHour;
    }

    public boolean contains(LocalTime time) {
        if (!isEnabled()) {
            return false;
        }
        int hour = time.getHour();
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }
}
