package com.epinet.service.core.aggregation;

import java.util.Map;

/**
 * Output of one aggregation chunk: funnel id to hour key to fully built hourly data. Every requested
 * (funnel, hour) pair is present, empty when nothing matched.
 */
public record ChunkResult(
        Map<String, Map<String, HourlyEpinetData>> byFunnel, int beliefRows, int actionRows, int skippedRows) {

    public ChunkResult {
        byFunnel = Map.copyOf(byFunnel);
    }

    public Map<String, HourlyEpinetData> hoursFor(String funnelId) {
        return byFunnel.getOrDefault(funnelId, Map.of());
    }
}
