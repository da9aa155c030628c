package com.epinet.service.core.view;

import java.util.Locale;

public enum EpinetDuration {
    DAILY(24),
    WEEKLY(168),
    MONTHLY(672);

    private final int hours;

    EpinetDuration(int hours) {
        this.hours = hours;
    }

    public int hours() {
        return hours;
    }

    public HourWindow toWindow() {
        return HourWindow.lastHours(hours);
    }

    public static EpinetDuration fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("duration must be provided");
        }
        try {
            return EpinetDuration.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown duration '" + name + "' (expected daily, weekly or monthly)");
        }
    }
}
