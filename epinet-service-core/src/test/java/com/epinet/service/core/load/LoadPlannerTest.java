package com.epinet.service.core.load;

import static org.assertj.core.api.Assertions.assertThat;

import com.epinet.service.core.aggregation.HourlyEpinetDataFixtures;
import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.store.InMemoryEpinetStore;
import com.epinet.service.core.time.HourBucketer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadPlannerTest {

    private InMemoryEpinetStore store;
    private EpinetProperties properties;
    private LoadPlanner planner;

    @BeforeEach
    void setUp() {
        store = new InMemoryEpinetStore();
        properties = new EpinetProperties();
        HourBucketer bucketer =
                new HourBucketer(Clock.fixed(Instant.parse("2024-01-01T10:35:00Z"), ZoneOffset.UTC));
        planner = new LoadPlanner(bucketer, store, properties);
    }

    @Test
    void coldStoreLoadsFullWindow() {
        assertThat(planner.plan("t1")).isEqualTo(LoadPlan.fullRange(672));
    }

    @Test
    void upToDateStoreRefreshesCurrentHourOnly() {
        seed("2024-01-01-10");

        assertThat(planner.plan("t1")).isEqualTo(LoadPlan.currentHour());
    }

    @Test
    void laggingStoreReloadsGapIncludingLastProcessedHour() {
        seed("2024-01-01-07");

        assertThat(planner.plan("t1")).isEqualTo(LoadPlan.fullRange(4));
    }

    @Test
    void gapIsCappedAtRetentionWindow() {
        seed("2023-11-01-10");

        assertThat(planner.plan("t1")).isEqualTo(LoadPlan.fullRange(672));
    }

    @Test
    void dataWithoutRefreshMarkerLoadsFullWindow() {
        store.put("t1", "f1", "2024-01-01-10", HourlyEpinetDataFixtures.hour().build());

        assertThat(planner.plan("t1").mode()).isEqualTo(RunMode.FULL_RANGE);
    }

    @Test
    void chunksPutRecentHoursFirst() {
        properties.getLoad().setRecentChunkHours(48);
        properties.getLoad().setHistoricalChunkHours(168);

        List<List<String>> chunks = planner.chunks(LoadPlan.fullRange(672));

        assertThat(chunks).extracting(List::size).containsExactly(48, 168, 168, 168, 120);
        assertThat(chunks.get(0).get(0)).isEqualTo("2024-01-01-10");
        assertThat(chunks.get(1).get(0)).isEqualTo("2023-12-30-10");
    }

    @Test
    void shortRangesFitInRecentChunk() {
        assertThat(planner.chunks(LoadPlan.fullRange(4)))
                .containsExactly(List.of("2024-01-01-10", "2024-01-01-09", "2024-01-01-08", "2024-01-01-07"));
        assertThat(planner.chunks(LoadPlan.currentHour())).containsExactly(List.of("2024-01-01-10"));
    }

    @Test
    void unreadableMarkerLoadsFullWindow() {
        seed("2024-1-1-10");

        assertThat(planner.plan("t1")).isEqualTo(LoadPlan.fullRange(672));
    }

    @Test
    void nonPositiveChunkSizesStillProduceChunks() {
        properties.getLoad().setRecentChunkHours(0);
        properties.getLoad().setHistoricalChunkHours(0);

        List<List<String>> chunks = planner.chunks(LoadPlan.fullRange(3));

        assertThat(chunks)
                .containsExactly(List.of("2024-01-01-10"), List.of("2024-01-01-09"), List.of("2024-01-01-08"));
    }

    private void seed(String lastFullHour) {
        store.put("t1", "f1", lastFullHour, HourlyEpinetDataFixtures.hour().build());
        store.markRefreshed("t1", lastFullHour, Instant.parse("2024-01-01T10:00:00Z"));
    }
}
