package com.epinet.service.core.tenant;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Resolves the JDBC template holding a tenant's funnel definitions and raw events.
 */
public interface TenantJdbcTemplates {

    NamedParameterJdbcTemplate forTenant(String tenantId);
}
