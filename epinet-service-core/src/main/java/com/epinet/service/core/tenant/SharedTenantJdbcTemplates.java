package com.epinet.service.core.tenant;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/** Serves every tenant from the application's single DataSource. */
@Component
public class SharedTenantJdbcTemplates implements TenantJdbcTemplates {

    private final NamedParameterJdbcTemplate jdbc;

    public SharedTenantJdbcTemplates(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public NamedParameterJdbcTemplate forTenant(String tenantId) {
        return jdbc;
    }
}
