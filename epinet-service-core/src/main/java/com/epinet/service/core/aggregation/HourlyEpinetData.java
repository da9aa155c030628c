package com.epinet.service.core.aggregation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregation of one funnel for one hour key: visitors per node and visitors per transition.
 *
 * <p>Instances are filled by a single chunk pass and handed to the store once complete; they are
 * not mutated after publication.
 */
public final class HourlyEpinetData {
    private final Map<String, NodeData> steps = new LinkedHashMap<>();
    private final Map<String, Map<String, TransitionData>> transitions = new LinkedHashMap<>();

    public Map<String, NodeData> steps() {
        return Collections.unmodifiableMap(steps);
    }

    public Map<String, Map<String, TransitionData>> transitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public NodeData node(String nodeId) {
        return steps.get(nodeId);
    }

    public TransitionData transition(String fromNodeId, String toNodeId) {
        Map<String, TransitionData> targets = transitions.get(fromNodeId);
        return targets == null ? null : targets.get(toNodeId);
    }

    /**
     * Registers a visitor for a node, creating the node on first sight. Registering the same visitor
     * twice is a no-op.
     */
    void addVisitor(String nodeId, String nodeName, int stepIndex, String visitorId) {
        steps.computeIfAbsent(nodeId, id -> new NodeData(nodeName, stepIndex)).addVisitor(visitorId);
    }

    void addTransition(String fromNodeId, String toNodeId, String visitorId) {
        transitions
                .computeIfAbsent(fromNodeId, id -> new LinkedHashMap<>())
                .computeIfAbsent(toNodeId, id -> new TransitionData())
                .addVisitor(visitorId);
    }

    void clearTransitions() {
        transitions.clear();
    }
}
