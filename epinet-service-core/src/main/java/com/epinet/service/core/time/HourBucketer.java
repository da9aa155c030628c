package com.epinet.service.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives hour keys relative to the current hour of the injected clock.
 */
@Component
public class HourBucketer {

    private final Clock clock;

    public HourBucketer(Clock clock) {
        this.clock = clock;
    }

    public Instant currentHourStart() {
        return HourKey.floor(Instant.now(clock));
    }

    public String currentHourKey() {
        return HourKey.format(currentHourStart());
    }

    /** Returns {@code hours} contiguous keys ending at the current hour, newest first. */
    public List<String> hourKeysForRange(int hours) {
        if (hours <= 0) {
            return List.of();
        }
        Instant current = currentHourStart();
        List<String> keys = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            keys.add(HourKey.format(current.minus(Duration.ofHours(i))));
        }
        return List.copyOf(keys);
    }

    /**
     * Returns the keys between two offsets expressed in hours before the current hour, both
     * inclusive, newest first. Offset order does not matter.
     */
    public List<String> hourKeysBetweenOffsets(int startHoursAgo, int endHoursAgo) {
        int newest = Math.max(0, Math.min(startHoursAgo, endHoursAgo));
        int oldest = Math.max(0, Math.max(startHoursAgo, endHoursAgo));
        Instant current = currentHourStart();
        List<String> keys = new ArrayList<>(oldest - newest + 1);
        for (int i = newest; i <= oldest; i++) {
            keys.add(HourKey.format(current.minus(Duration.ofHours(i))));
        }
        return List.copyOf(keys);
    }

    /**
     * Spans the oldest to the newest key plus one hour. Keys may be supplied in any order.
     */
    public static TimeRange rangeBounds(List<String> hourKeys) {
        if (hourKeys == null || hourKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one hour key is required");
        }
        Instant oldest = null;
        Instant newest = null;
        for (String key : hourKeys) {
            Instant start = HourKey.parse(key);
            if (oldest == null || start.isBefore(oldest)) {
                oldest = start;
            }
            if (newest == null || start.isAfter(newest)) {
                newest = start;
            }
        }
        return new TimeRange(oldest, newest.plus(HourKey.HOUR));
    }

    /** Whole hours between the start of the given key and the current hour. */
    public long hoursSince(String hourKey) {
        Duration diff = Duration.between(HourKey.parse(hourKey), currentHourStart());
        return diff.toHours();
    }
}
