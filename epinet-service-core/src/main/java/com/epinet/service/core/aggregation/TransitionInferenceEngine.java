package com.epinet.service.core.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Derives directed node-to-node transitions for one hour bucket from the visitors registered on each
 * node. Edges only ever point forward or sideways in step order.
 */
@Component
public class TransitionInferenceEngine {

    /**
     * Rebuilds {@code data.transitions()} from {@code data.steps()}. Existing transitions are
     * discarded so repeated calls on the same data yield the same result.
     */
    public void infer(HourlyEpinetData data) {
        data.clearTransitions();
        Map<String, NodeData> steps = data.steps();

        Map<String, List<String>> nodesByVisitor = new LinkedHashMap<>();
        steps.forEach((nodeId, node) -> {
            for (String visitorId : node.visitors()) {
                nodesByVisitor
                        .computeIfAbsent(visitorId, v -> new ArrayList<>())
                        .add(nodeId);
            }
        });

        Comparator<String> order = Comparator.<String>comparingInt(
                        id -> steps.get(id).stepIndex())
                .thenComparing(Comparator.naturalOrder());

        for (Map.Entry<String, List<String>> entry : nodesByVisitor.entrySet()) {
            List<String> nodes = entry.getValue();
            if (nodes.size() < 2) {
                continue;
            }
            nodes.sort(order);
            String visitorId = entry.getKey();
            for (int i = 0; i < nodes.size(); i++) {
                String from = nodes.get(i);
                int fromIndex = steps.get(from).stepIndex();
                for (int j = i + 1; j < nodes.size(); j++) {
                    String to = nodes.get(j);
                    if (from.equals(to)) {
                        continue;
                    }
                    if (fromIndex <= steps.get(to).stepIndex()) {
                        data.addTransition(from, to, visitorId);
                    }
                }
            }
        }
    }
}
