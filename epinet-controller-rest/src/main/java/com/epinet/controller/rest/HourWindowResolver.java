package com.epinet.controller.rest;

import com.epinet.service.core.view.EpinetDuration;
import com.epinet.service.core.view.HourWindow;

/**
 * Resolves the window query parameters. Precedence: explicit offsets, then {@code hours}, then the
 * named duration; weekly when nothing is given. Explicit offsets and hours may not reach past the
 * retention window of {@code maxHours} buckets.
 */
public final class HourWindowResolver {

    static final EpinetDuration DEFAULT_DURATION = EpinetDuration.WEEKLY;

    private HourWindowResolver() {}

    public static HourWindow resolve(
            String duration, Integer hours, Integer startHour, Integer endHour, int maxHours) {
        if (startHour != null || endHour != null) {
            if (startHour == null || endHour == null) {
                throw new IllegalArgumentException("startHour and endHour must be provided together");
            }
            if (startHour >= maxHours || endHour >= maxHours) {
                throw new IllegalArgumentException("startHour and endHour must be below " + maxHours);
            }
            return HourWindow.offsets(startHour, endHour);
        }
        if (hours != null) {
            if (hours > maxHours) {
                throw new IllegalArgumentException("hours must be between 1 and " + maxHours);
            }
            return HourWindow.lastHours(hours);
        }
        if (duration != null && !duration.isBlank()) {
            return EpinetDuration.fromName(duration).toWindow();
        }
        return DEFAULT_DURATION.toWindow();
    }

    /** Like {@link #resolve} but returns {@code null} when no window parameter is present. */
    public static HourWindow resolveOptional(
            String duration, Integer hours, Integer startHour, Integer endHour, int maxHours) {
        if (startHour == null && endHour == null && hours == null && (duration == null || duration.isBlank())) {
            return null;
        }
        return resolve(duration, hours, startHour, endHour, maxHours);
    }
}
