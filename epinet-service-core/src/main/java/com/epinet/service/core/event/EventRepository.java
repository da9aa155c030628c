package com.epinet.service.core.event;

import com.epinet.service.core.time.TimeRange;
import java.util.List;

/**
 * Time- and criteria-bounded reads of the raw event tables. Failures surface as Spring
 * {@code DataAccessException}s.
 */
public interface EventRepository {

    List<BeliefEventRow> findBeliefEvents(String tenantId, TimeRange range, EventCriteria criteria);

    List<ActionEventRow> findActionEvents(String tenantId, TimeRange range, EventCriteria criteria);
}
