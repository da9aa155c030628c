package com.epinet.service.core.funnel;

import com.epinet.service.core.tenant.TenantJdbcTemplates;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcFunnelRepository implements FunnelRepository {

    private static final String SELECT_ALL_SQL =
            """
        select id, title, options_payload
        from epinets
        order by id
        """;

    private final TenantJdbcTemplates templates;

    public JdbcFunnelRepository(TenantJdbcTemplates templates) {
        this.templates = templates;
    }

    @Override
    public List<FunnelRecord> findAll(String tenantId) {
        return templates
                .forTenant(tenantId)
                .query(
                        SELECT_ALL_SQL,
                        new MapSqlParameterSource(),
                        (rs, rowNum) -> new FunnelRecord(
                                rs.getString("id"), rs.getString("title"), rs.getString("options_payload")));
    }
}
