package com.epinet.service.core.time;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical hour bucket identifier {@code YYYY-MM-DD-HH} on a UTC basis. Zero padding keeps the
 * lexicographic order identical to the chronological one.
 */
public final class HourKey {

    public static final Duration HOUR = Duration.ofHours(1);

    private static final Pattern PATTERN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})-(\\d{2})");

    private HourKey() {}

    public static String format(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("Instant must be provided to format an hour key");
        }
        ZonedDateTime zdt = instant.atZone(ZoneOffset.UTC);
        return String.format(
                "%04d-%02d-%02d-%02d", zdt.getYear(), zdt.getMonthValue(), zdt.getDayOfMonth(), zdt.getHour());
    }

    /** Returns the inclusive start of the hour the key denotes. */
    public static Instant parse(String hourKey) {
        if (hourKey == null) {
            throw new IllegalArgumentException("Hour key must be provided");
        }
        Matcher m = PATTERN.matcher(hourKey);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid hour key format: " + hourKey);
        }
        int year = Integer.parseInt(m.group(1));
        if (year < 1000) {
            throw new IllegalArgumentException("Invalid year in hour key: " + hourKey);
        }
        int month = Integer.parseInt(m.group(2));
        int day = Integer.parseInt(m.group(3));
        int hour = Integer.parseInt(m.group(4));
        try {
            return LocalDateTime.of(year, month, day, hour, 0).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Invalid date values in hour key: " + hourKey, ex);
        }
    }

    public static boolean isValid(String hourKey) {
        try {
            parse(hourKey);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /** Aligns the instant to the start of its containing hour. */
    public static Instant floor(Instant instant) {
        long hourMillis = HOUR.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), hourMillis) * hourMillis);
    }
}
