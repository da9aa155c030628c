package com.epinet.service.core.store;

import com.epinet.service.core.aggregation.HourlyEpinetData;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryEpinetStore implements EpinetStore {

    private final Map<String, TenantData> tenants = new ConcurrentHashMap<>();

    @Override
    public Optional<HourlyEpinetData> get(String tenantId, String funnelId, String hourKey) {
        TenantData tenant = tenants.get(tenantId);
        if (tenant == null) {
            return Optional.empty();
        }
        Map<String, HourlyEpinetData> hours = tenant.funnels.get(funnelId);
        return hours == null ? Optional.empty() : Optional.ofNullable(hours.get(hourKey));
    }

    @Override
    public void put(String tenantId, String funnelId, String hourKey, HourlyEpinetData data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        tenant(tenantId)
                .funnels
                .computeIfAbsent(funnelId, id -> new ConcurrentSkipListMap<>(Comparator.reverseOrder()))
                .put(hourKey, data);
    }

    @Override
    public void delete(String tenantId, String funnelId, String hourKey) {
        TenantData tenant = tenants.get(tenantId);
        if (tenant == null) {
            return;
        }
        Map<String, HourlyEpinetData> hours = tenant.funnels.get(funnelId);
        if (hours != null) {
            hours.remove(hourKey);
        }
    }

    @Override
    public Set<String> hourKeys(String tenantId, String funnelId) {
        TenantData tenant = tenants.get(tenantId);
        if (tenant == null) {
            return Set.of();
        }
        Map<String, HourlyEpinetData> hours = tenant.funnels.get(funnelId);
        return hours == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(hours.keySet()));
    }

    @Override
    public Set<String> funnelIds(String tenantId) {
        TenantData tenant = tenants.get(tenantId);
        return tenant == null ? Set.of() : Set.copyOf(tenant.funnels.keySet());
    }

    @Override
    public boolean hasData(String tenantId) {
        TenantData tenant = tenants.get(tenantId);
        return tenant != null && tenant.funnels.values().stream().anyMatch(hours -> !hours.isEmpty());
    }

    @Override
    public Optional<String> lastFullHour(String tenantId) {
        TenantData tenant = tenants.get(tenantId);
        return tenant == null ? Optional.empty() : Optional.ofNullable(tenant.lastFullHour);
    }

    @Override
    public Optional<Instant> lastUpdateTime(String tenantId) {
        TenantData tenant = tenants.get(tenantId);
        return tenant == null ? Optional.empty() : Optional.ofNullable(tenant.lastUpdateTime);
    }

    @Override
    public void markRefreshed(String tenantId, String lastFullHour, Instant updatedAt) {
        TenantData tenant = tenant(tenantId);
        tenant.lastFullHour = lastFullHour;
        tenant.lastUpdateTime = updatedAt;
    }

    private TenantData tenant(String tenantId) {
        return tenants.computeIfAbsent(tenantId, id -> new TenantData());
    }

    private static final class TenantData {
        private final Map<String, Map<String, HourlyEpinetData>> funnels = new ConcurrentHashMap<>();
        private volatile String lastFullHour;
        private volatile Instant lastUpdateTime;
    }
}
