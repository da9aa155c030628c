package com.epinet.service.core.store;

import com.epinet.service.core.aggregation.HourlyEpinetData;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregated hourly data per tenant, funnel and hour key, plus per-tenant refresh markers. Values are
 * replaced whole (last writer wins per hour key), never mutated in place.
 */
public interface EpinetStore {

    Optional<HourlyEpinetData> get(String tenantId, String funnelId, String hourKey);

    void put(String tenantId, String funnelId, String hourKey, HourlyEpinetData data);

    void delete(String tenantId, String funnelId, String hourKey);

    /** Stored hour keys for a funnel, newest first. */
    Set<String> hourKeys(String tenantId, String funnelId);

    Set<String> funnelIds(String tenantId);

    boolean hasData(String tenantId);

    Optional<String> lastFullHour(String tenantId);

    Optional<Instant> lastUpdateTime(String tenantId);

    void markRefreshed(String tenantId, String lastFullHour, Instant updatedAt);
}
