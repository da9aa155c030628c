package com.epinet.service.core.load;

import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.store.EpinetStore;
import com.epinet.service.core.time.HourBucketer;
import com.epinet.service.core.time.HourKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chooses between a current-hour refresh and a full-range run from what the store already holds, and
 * splits a plan into hour-key chunks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoadPlanner {

    private final HourBucketer bucketer;
    private final EpinetStore store;
    private final EpinetProperties properties;

    public LoadPlan plan(String tenantId) {
        int maxHours = properties.getLoad().getMaxAnalyticsHours();
        Optional<String> lastFullHour = store.lastFullHour(tenantId);
        if (!store.hasData(tenantId) || lastFullHour.isEmpty()) {
            return LoadPlan.fullRange(maxHours);
        }
        if (!HourKey.isValid(lastFullHour.get())) {
            log.warn("Ignoring unreadable last full hour {} for tenant {}", lastFullHour.get(), tenantId);
            return LoadPlan.fullRange(maxHours);
        }
        long gap = bucketer.hoursSince(lastFullHour.get());
        if (gap <= 0) {
            return LoadPlan.currentHour();
        }
        // the last processed hour was still open when it ran, so it is reloaded too
        return LoadPlan.fullRange((int) Math.min(maxHours, gap + 1));
    }

    /** Hour-key chunks in processing order: current hour or recent chunk first, newest first within. */
    public List<List<String>> chunks(LoadPlan plan) {
        if (plan.mode() == RunMode.CURRENT_HOUR) {
            return List.of(List.of(bucketer.currentHourKey()));
        }
        List<String> keys = bucketer.hourKeysForRange(plan.hours());
        int recent = Math.max(1, Math.min(properties.getLoad().getRecentChunkHours(), keys.size()));
        int historical = Math.max(1, properties.getLoad().getHistoricalChunkHours());
        List<List<String>> chunks = new ArrayList<>();
        chunks.add(keys.subList(0, recent));
        for (int from = recent; from < keys.size(); from += historical) {
            chunks.add(keys.subList(from, Math.min(keys.size(), from + historical)));
        }
        return List.copyOf(chunks);
    }
}
