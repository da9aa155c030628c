package com.epinet.service.core.event;

import com.epinet.service.core.tenant.TenantJdbcTemplates;
import com.epinet.service.core.time.TimeRange;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@Slf4j
public class JdbcEventRepository implements EventRepository {

    private static final String BELIEF_SQL =
            """
        select h.updated_at, h.belief_id, h.fingerprint_id, h.verb, h.object
        from heldbeliefs h
        join beliefs b on h.belief_id = b.id
        where h.updated_at >= :start
          and h.updated_at < :end
          and (%s)
        """;

    private static final String ACTION_SQL =
            """
        select created_at, object_id, object_type, fingerprint_id, verb
        from actions
        where created_at >= :start
          and created_at < :end
          and verb in (:verbs)%s
        """;

    private final TenantJdbcTemplates templates;

    public JdbcEventRepository(TenantJdbcTemplates templates) {
        this.templates = templates;
    }

    @Override
    public List<BeliefEventRow> findBeliefEvents(String tenantId, TimeRange range, EventCriteria criteria) {
        if (!criteria.hasBeliefCriteria()) {
            return List.of();
        }
        MapSqlParameterSource params = timeParams(range);
        List<String> conditions = new ArrayList<>(2);
        if (!criteria.beliefVerbs().isEmpty()) {
            conditions.add("h.verb in (:verbs)");
            params.addValue("verbs", List.copyOf(criteria.beliefVerbs()));
        }
        if (!criteria.identifyAsObjects().isEmpty()) {
            conditions.add("h.object in (:objects)");
            params.addValue("objects", List.copyOf(criteria.identifyAsObjects()));
        }
        String sql = BELIEF_SQL.formatted(String.join(" or ", conditions));
        List<BeliefEventRow> rows = templates
                .forTenant(tenantId)
                .query(
                        sql,
                        params,
                        (rs, rowNum) -> new BeliefEventRow(
                                toInstant(rs.getTimestamp("updated_at")),
                                rs.getString("belief_id"),
                                rs.getString("fingerprint_id"),
                                rs.getString("verb"),
                                rs.getString("object")));
        log.debug("Polled {} belief rows for tenant {} in {}", rows.size(), tenantId, range);
        return rows;
    }

    @Override
    public List<ActionEventRow> findActionEvents(String tenantId, TimeRange range, EventCriteria criteria) {
        if (!criteria.hasActionCriteria()) {
            return List.of();
        }
        MapSqlParameterSource params = timeParams(range).addValue("verbs", List.copyOf(criteria.actionVerbs()));
        StringBuilder extra = new StringBuilder();
        if (!criteria.actionObjectTypes().isEmpty()) {
            extra.append("\n  and object_type in (:object_types)");
            params.addValue("object_types", List.copyOf(criteria.actionObjectTypes()));
        }
        if (!criteria.actionObjectIds().isEmpty()) {
            extra.append("\n  and object_id in (:object_ids)");
            params.addValue("object_ids", List.copyOf(criteria.actionObjectIds()));
        }
        List<ActionEventRow> rows = templates
                .forTenant(tenantId)
                .query(
                        ACTION_SQL.formatted(extra),
                        params,
                        (rs, rowNum) -> new ActionEventRow(
                                toInstant(rs.getTimestamp("created_at")),
                                rs.getString("object_id"),
                                rs.getString("object_type"),
                                rs.getString("fingerprint_id"),
                                rs.getString("verb")));
        log.debug("Polled {} action rows for tenant {} in {}", rows.size(), tenantId, range);
        return rows;
    }

    private static MapSqlParameterSource timeParams(TimeRange range) {
        return new MapSqlParameterSource()
                .addValue("start", Timestamp.from(range.start()))
                .addValue("end", Timestamp.from(range.end()));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
