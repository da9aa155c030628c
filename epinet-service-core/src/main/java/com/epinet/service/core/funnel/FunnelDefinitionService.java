package com.epinet.service.core.funnel;

import com.epinet.funnel.model.Funnel;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Loads the tenant's funnels fresh from storage. Definitions can change between runs, so nothing is
 * cached here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FunnelDefinitionService {

    private final FunnelRepository repository;
    private final FunnelPayloadParser parser;

    public List<Funnel> loadFunnels(String tenantId) {
        List<FunnelRecord> records = repository.findAll(tenantId);
        List<Funnel> funnels = new ArrayList<>(records.size());
        for (FunnelRecord record : records) {
            if (record.id() == null || record.id().isBlank()) {
                log.warn("Skipping funnel row without id for tenant {}", tenantId);
                continue;
            }
            funnels.add(parser.parse(record.id(), record.title(), record.optionsPayload()));
        }
        log.debug("Loaded {} funnels for tenant {}", funnels.size(), tenantId);
        return List.copyOf(funnels);
    }
}
