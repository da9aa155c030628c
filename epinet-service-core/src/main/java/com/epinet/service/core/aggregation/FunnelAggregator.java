package com.epinet.service.core.aggregation;

import com.epinet.funnel.model.Funnel;
import com.epinet.funnel.model.FunnelStep;
import com.epinet.service.core.event.ActionEventRow;
import com.epinet.service.core.event.BeliefEventRow;
import com.epinet.service.core.event.EventCriteria;
import com.epinet.service.core.event.EventRepository;
import com.epinet.service.core.telemetry.EpinetLoadTelemetry;
import com.epinet.service.core.time.HourBucketer;
import com.epinet.service.core.time.HourKey;
import com.epinet.service.core.time.TimeRange;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Aggregates one time chunk for a set of funnels: two consolidated queries, in-memory classification
 * against every (funnel, step) pair, then transition inference per (funnel, hour).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FunnelAggregator {

    private final EventRepository eventRepository;
    private final TransitionInferenceEngine transitionEngine;
    private final EpinetLoadTelemetry telemetry;

    public ChunkResult aggregate(
            String tenantId, List<String> hourKeys, List<Funnel> funnels, Map<String, String> contentTitles) {
        return aggregate(tenantId, hourKeys, funnels, contentTitles, AggregationProgressListener.NONE);
    }

    public ChunkResult aggregate(
            String tenantId,
            List<String> hourKeys,
            List<Funnel> funnels,
            Map<String, String> contentTitles,
            AggregationProgressListener listener) {
        Set<String> requested = new LinkedHashSet<>(hourKeys);
        Map<String, Map<String, HourlyEpinetData>> byFunnel = new LinkedHashMap<>();
        for (Funnel funnel : funnels) {
            Map<String, HourlyEpinetData> hours = new LinkedHashMap<>();
            for (String hourKey : requested) {
                hours.put(hourKey, new HourlyEpinetData());
            }
            byFunnel.put(funnel.id(), hours);
        }
        if (requested.isEmpty() || funnels.isEmpty()) {
            return new ChunkResult(byFunnel, 0, 0, 0);
        }

        TimeRange range = HourBucketer.rangeBounds(hourKeys);
        EventCriteria criteria = EventCriteria.from(funnels);
        List<Funnel> classified = funnels.stream().filter(Funnel::hasSteps).toList();

        List<BeliefEventRow> beliefRows = criteria.hasBeliefCriteria()
                ? eventRepository.findBeliefEvents(tenantId, range, criteria)
                : List.of();
        List<ActionEventRow> actionRows = criteria.hasActionCriteria()
                ? eventRepository.findActionEvents(tenantId, range, criteria)
                : List.of();

        int skipped = 0;
        for (BeliefEventRow row : beliefRows) {
            if (row.updatedAt() == null || row.visitorId() == null) {
                skipped++;
                continue;
            }
            String hourKey = HourKey.format(row.updatedAt());
            if (!requested.contains(hourKey)) {
                skipped++;
                continue;
            }
            for (Funnel funnel : classified) {
                HourlyEpinetData data = byFunnel.get(funnel.id()).get(hourKey);
                List<FunnelStep> steps = funnel.steps();
                for (int i = 0; i < steps.size(); i++) {
                    FunnelStep step = steps.get(i);
                    if (step.gateType().isBelief() && EventClassifier.matchBelief(row, step)) {
                        String nodeId = NodeIdentity.nodeId(step, NodeIdentity.NO_CONTENT_ID);
                        String name = NodeIdentity.nodeName(step, NodeIdentity.NO_CONTENT_ID, contentTitles);
                        data.addVisitor(nodeId, name, funnel.stepIndexOf(i), row.visitorId());
                    }
                }
            }
        }

        for (ActionEventRow row : actionRows) {
            if (row.createdAt() == null || row.visitorId() == null) {
                skipped++;
                continue;
            }
            String hourKey = HourKey.format(row.createdAt());
            if (!requested.contains(hourKey)) {
                skipped++;
                continue;
            }
            for (Funnel funnel : classified) {
                HourlyEpinetData data = byFunnel.get(funnel.id()).get(hourKey);
                List<FunnelStep> steps = funnel.steps();
                for (int i = 0; i < steps.size(); i++) {
                    FunnelStep step = steps.get(i);
                    if (step.gateType().isAction() && EventClassifier.matchAction(row, step)) {
                        String nodeId = NodeIdentity.nodeId(step, row.objectId());
                        String name = NodeIdentity.nodeName(step, row.objectId(), contentTitles);
                        data.addVisitor(nodeId, name, funnel.stepIndexOf(i), row.visitorId());
                    }
                }
            }
        }

        for (Funnel funnel : funnels) {
            listener.funnelStarted(funnel.id());
            byFunnel.get(funnel.id()).values().forEach(transitionEngine::infer);
            listener.funnelCompleted(funnel.id());
        }

        telemetry.recordRowsClassified(beliefRows.size(), actionRows.size());
        if (skipped > 0) {
            log.debug("Skipped {} rows outside the requested hours for tenant {} ({})", skipped, tenantId, range);
        }
        return new ChunkResult(byFunnel, beliefRows.size(), actionRows.size(), skipped);
    }
}
