package com.epinet.service.core.aggregation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Distinct visitors of one node within one hour bucket. */
public final class NodeData {
    private final String name;
    private final int stepIndex;
    private final Set<String> visitors = new LinkedHashSet<>();

    NodeData(String name, int stepIndex) {
        this.name = name;
        this.stepIndex = stepIndex;
    }

    public String name() {
        return name;
    }

    public int stepIndex() {
        return stepIndex;
    }

    public Set<String> visitors() {
        return Collections.unmodifiableSet(visitors);
    }

    boolean addVisitor(String visitorId) {
        return visitors.add(visitorId);
    }
}
