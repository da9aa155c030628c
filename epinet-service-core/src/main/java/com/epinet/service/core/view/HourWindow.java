package com.epinet.service.core.view;

import com.epinet.service.core.time.HourBucketer;
import java.util.List;

/**
 * A span of hour buckets expressed as offsets from the current hour; {@code 0} is the current hour.
 * Both ends are inclusive and may be given in either order.
 */
public record HourWindow(int startHoursAgo, int endHoursAgo) {

    public HourWindow {
        if (startHoursAgo < 0 || endHoursAgo < 0) {
            throw new IllegalArgumentException(
                    "Hour offsets must not be negative: " + startHoursAgo + ", " + endHoursAgo);
        }
    }

    /** The {@code hours} most recent buckets, current hour included. */
    public static HourWindow lastHours(int hours) {
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
        return new HourWindow(hours - 1, 0);
    }

    public static HourWindow offsets(int startHoursAgo, int endHoursAgo) {
        return new HourWindow(startHoursAgo, endHoursAgo);
    }

    /**
     * Keys of this window that fall inside the {@code maxHours} most recent buckets, newest first.
     * Older buckets are never retained, so they are not enumerated.
     */
    public List<String> hourKeys(HourBucketer bucketer, int maxHours) {
        int newest = Math.min(startHoursAgo, endHoursAgo);
        if (newest >= maxHours) {
            return List.of();
        }
        int oldest = Math.min(Math.max(startHoursAgo, endHoursAgo), maxHours - 1);
        return bucketer.hourKeysBetweenOffsets(newest, oldest);
    }
}
