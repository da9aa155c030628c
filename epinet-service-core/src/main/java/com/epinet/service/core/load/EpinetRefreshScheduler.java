package com.epinet.service.core.load;

import com.epinet.service.core.config.EpinetProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class EpinetRefreshScheduler {
    private final EpinetLoadOrchestrator orchestrator;
    private final EpinetProperties properties;

    @Scheduled(fixedRateString = "${epinet.refresh.rate-millis:60000}")
    public void refresh() {
        if (!properties.getRefresh().isEnabled()) {
            return;
        }
        for (String tenantId : properties.getRefresh().getTenants()) {
            try {
                RefreshOutcome outcome = orchestrator.requestRefresh(tenantId);
                log.debug("Scheduled epinet refresh tenant={} outcome={}", tenantId, outcome);
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping scheduled refresh for tenant '{}': {}", tenantId, ex.getMessage());
            }
        }
    }
}
