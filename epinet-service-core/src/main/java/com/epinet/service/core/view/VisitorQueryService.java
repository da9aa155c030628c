package com.epinet.service.core.view;

import com.epinet.service.core.aggregation.HourlyEpinetData;
import com.epinet.service.core.aggregation.NodeData;
import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.store.EpinetStore;
import com.epinet.service.core.time.HourBucketer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VisitorQueryService {

    private final EpinetStore store;
    private final HourBucketer bucketer;
    private final EpinetProperties properties;

    /**
     * Distinct visitors seen on any node of the funnel, most active first (by node-hour memberships),
     * ties broken by id. A {@code null} window covers every stored hour.
     */
    public List<String> visitorIds(String tenantId, String funnelId, HourWindow window) {
        Collection<String> hourKeys = window == null
                ? store.hourKeys(tenantId, funnelId)
                : window.hourKeys(bucketer, properties.getLoad().getMaxAnalyticsHours());
        Map<String, Integer> counts = new HashMap<>();
        for (String hourKey : hourKeys) {
            HourlyEpinetData data = store.get(tenantId, funnelId, hourKey).orElse(null);
            if (data == null) {
                continue;
            }
            for (NodeData node : data.steps().values()) {
                node.visitors().forEach(visitor -> counts.merge(visitor, 1, Integer::sum));
            }
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()));
        return entries.stream().map(Map.Entry::getKey).toList();
    }
}
