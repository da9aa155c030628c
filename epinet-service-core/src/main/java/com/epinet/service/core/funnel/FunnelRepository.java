package com.epinet.service.core.funnel;

import java.util.List;

public interface FunnelRepository {

    List<FunnelRecord> findAll(String tenantId);
}
