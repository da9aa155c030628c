package com.epinet.service.core.view;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.epinet.service.core.time.HourBucketer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class HourWindowTest {

    private final HourBucketer bucketer =
            new HourBucketer(Clock.fixed(Instant.parse("2024-01-01T10:35:00Z"), ZoneOffset.UTC));

    @Test
    void lastHoursMatchesBucketerRange() {
        assertThat(HourWindow.lastHours(24).hourKeys(bucketer, 672)).isEqualTo(bucketer.hourKeysForRange(24));
        assertThat(EpinetDuration.MONTHLY.toWindow().hourKeys(bucketer, 672)).hasSize(672);
    }

    @Test
    void keysStopAtRetentionWindow() {
        assertThat(HourWindow.lastHours(Integer.MAX_VALUE).hourKeys(bucketer, 672))
                .isEqualTo(bucketer.hourKeysForRange(672));
        assertThat(HourWindow.offsets(5_000_000, 670).hourKeys(bucketer, 672))
                .containsExactly("2023-12-04-12", "2023-12-04-11");
        assertThat(HourWindow.offsets(700, 5_000_000).hourKeys(bucketer, 672)).isEmpty();
    }

    @Test
    void namedDurationsParseCaseInsensitively() {
        assertThat(EpinetDuration.fromName("Daily")).isEqualTo(EpinetDuration.DAILY);
        assertThat(EpinetDuration.fromName("weekly").hours()).isEqualTo(168);
        assertThatThrownBy(() -> EpinetDuration.fromName("yearly")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeOffsetsAndEmptyWindows() {
        assertThatThrownBy(() -> HourWindow.offsets(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HourWindow.lastHours(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
