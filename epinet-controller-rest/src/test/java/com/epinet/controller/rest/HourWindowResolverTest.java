package com.epinet.controller.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.epinet.service.core.view.HourWindow;
import org.junit.jupiter.api.Test;

class HourWindowResolverTest {

    private static final int MAX_HOURS = 672;

    @Test
    void prefersExplicitOffsets() {
        HourWindow window = HourWindowResolver.resolve("daily", 5, 48, 24, MAX_HOURS);

        assertEquals(HourWindow.offsets(48, 24), window);
    }

    @Test
    void hoursBeatNamedDuration() {
        assertEquals(HourWindow.lastHours(5), HourWindowResolver.resolve("monthly", 5, null, null, MAX_HOURS));
        assertEquals(HourWindow.lastHours(24), HourWindowResolver.resolve("daily", null, null, null, MAX_HOURS));
    }

    @Test
    void defaultsToWeekly() {
        assertEquals(HourWindow.lastHours(168), HourWindowResolver.resolve(null, null, null, null, MAX_HOURS));
        assertNull(HourWindowResolver.resolveOptional(" ", null, null, null, MAX_HOURS));
    }

    @Test
    void windowsPastRetentionAreRejected() {
        assertEquals(HourWindow.lastHours(672), HourWindowResolver.resolve(null, 672, null, null, MAX_HOURS));
        assertThrows(
                IllegalArgumentException.class,
                () -> HourWindowResolver.resolve(null, Integer.MAX_VALUE, null, null, MAX_HOURS));
        assertThrows(
                IllegalArgumentException.class, () -> HourWindowResolver.resolve(null, null, 672, 0, MAX_HOURS));
    }

    @Test
    void halfSpecifiedOffsetsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> HourWindowResolver.resolve(null, null, 10, null, MAX_HOURS));
    }
}
