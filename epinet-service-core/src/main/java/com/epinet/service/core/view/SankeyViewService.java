package com.epinet.service.core.view;

import com.epinet.service.core.aggregation.HourlyEpinetData;
import com.epinet.service.core.aggregation.NodeData;
import com.epinet.service.core.aggregation.TransitionData;
import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.load.EpinetLoadOrchestrator;
import com.epinet.service.core.load.RefreshOutcome;
import com.epinet.service.core.store.EpinetStore;
import com.epinet.service.core.time.HourBucketer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Flattens stored hourly data for one funnel into a Sankey diagram. Reads never block on a running
 * load; the caller gets the last merged data together with the tenant's load status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SankeyViewService {

    private final EpinetStore store;
    private final EpinetLoadOrchestrator orchestrator;
    private final HourBucketer bucketer;
    private final EpinetProperties properties;

    public EpinetViewResult computeSankey(String tenantId, String funnelId, HourWindow window) {
        return computeSankey(tenantId, funnelId, window, null);
    }

    /**
     * @param visitorId when set, only this visitor's node memberships and transitions are counted
     */
    public EpinetViewResult computeSankey(String tenantId, String funnelId, HourWindow window, String visitorId) {
        if (window == null) {
            throw new IllegalArgumentException("window must be provided");
        }
        if (!store.hasData(tenantId)) {
            RefreshOutcome outcome = orchestrator.requestRefresh(tenantId);
            log.debug("No epinet data for tenant {}, refresh outcome={}", tenantId, outcome);
            return EpinetViewResult.loading(orchestrator.getLoadStatus(tenantId));
        }
        if (!store.funnelIds(tenantId).contains(funnelId)) {
            RefreshOutcome outcome = orchestrator.requestRefresh(tenantId);
            return outcome == RefreshOutcome.STARTED
                    ? EpinetViewResult.loading(orchestrator.getLoadStatus(tenantId))
                    : EpinetViewResult.notFound(orchestrator.getLoadStatus(tenantId));
        }
        List<String> hourKeys = window.hourKeys(bucketer, properties.getLoad().getMaxAnalyticsHours());
        SankeyDiagram diagram = buildDiagram(tenantId, funnelId, hourKeys, visitorId);
        return EpinetViewResult.ready(diagram, orchestrator.getLoadStatus(tenantId));
    }

    SankeyDiagram buildDiagram(String tenantId, String funnelId, List<String> hourKeys, String visitorId) {
        Map<String, Set<String>> nodeVisitors = new LinkedHashMap<>();
        Map<String, String> nodeNames = new HashMap<>();
        Map<String, Map<String, Set<String>>> linkVisitors = new HashMap<>();

        for (String hourKey : hourKeys) {
            Optional<HourlyEpinetData> stored = store.get(tenantId, funnelId, hourKey);
            if (stored.isEmpty()) {
                continue;
            }
            HourlyEpinetData data = stored.get();
            for (Map.Entry<String, NodeData> entry : data.steps().entrySet()) {
                Set<String> visitors = nodeVisitors.computeIfAbsent(entry.getKey(), id -> new HashSet<>());
                addVisitors(visitors, entry.getValue().visitors(), visitorId);
                nodeNames.putIfAbsent(entry.getKey(), entry.getValue().name());
            }
            for (Map.Entry<String, Map<String, TransitionData>> from :
                    data.transitions().entrySet()) {
                for (Map.Entry<String, TransitionData> to : from.getValue().entrySet()) {
                    Set<String> visitors = linkVisitors
                            .computeIfAbsent(from.getKey(), id -> new HashMap<>())
                            .computeIfAbsent(to.getKey(), id -> new HashSet<>());
                    addVisitors(visitors, to.getValue().visitors(), visitorId);
                }
            }
        }

        List<String> topNodes = nodeVisitors.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .sorted(Comparator.<Map.Entry<String, Set<String>>>comparingInt(
                                entry -> entry.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry.<String, Set<String>>comparingByKey()))
                .limit(properties.getView().getMaxSankeyNodes())
                .map(Map.Entry::getKey)
                .toList();

        Map<String, Integer> indexes = new HashMap<>();
        List<SankeyDiagram.Node> nodes = new ArrayList<>(topNodes.size());
        for (String nodeId : topNodes) {
            indexes.put(nodeId, nodes.size());
            nodes.add(new SankeyDiagram.Node(nodeId, nodeNames.get(nodeId)));
        }

        List<SankeyDiagram.Link> links = new ArrayList<>();
        for (String from : topNodes) {
            Map<String, Set<String>> targets = linkVisitors.getOrDefault(from, Map.of());
            for (String to : topNodes) {
                Set<String> visitors = targets.get(to);
                if (visitors != null && !visitors.isEmpty()) {
                    links.add(new SankeyDiagram.Link(indexes.get(from), indexes.get(to), visitors.size()));
                }
            }
        }
        return new SankeyDiagram(funnelId, SankeyDiagram.DEFAULT_TITLE, nodes, links);
    }

    private static void addVisitors(Set<String> target, Set<String> source, String visitorId) {
        if (visitorId == null) {
            target.addAll(source);
        } else if (source.contains(visitorId)) {
            target.add(visitorId);
        }
    }
}
