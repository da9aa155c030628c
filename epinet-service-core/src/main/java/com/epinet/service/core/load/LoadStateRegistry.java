package com.epinet.service.core.load;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Owns the per-tenant load state; one instance per orchestrator. */
@Component
public class LoadStateRegistry {
    private final Map<String, TenantLoadState> states = new ConcurrentHashMap<>();

    public TenantLoadState state(String tenantId) {
        return states.computeIfAbsent(tenantId, id -> new TenantLoadState());
    }

    public Optional<TenantLoadState> find(String tenantId) {
        return Optional.ofNullable(states.get(tenantId));
    }
}
