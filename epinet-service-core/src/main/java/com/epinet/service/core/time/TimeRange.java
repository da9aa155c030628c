package com.epinet.service.core.time;

import java.time.Instant;

/** Half-open interval {@code [start, end)}. */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must be provided");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Time range end must be after start: " + start + " .. " + end);
        }
    }
}
