package com.epinet.service.core.aggregation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Visitors who reached both ends of a directed node pair within one hour bucket. */
public final class TransitionData {
    private final Set<String> visitors = new LinkedHashSet<>();

    public Set<String> visitors() {
        return Collections.unmodifiableSet(visitors);
    }

    void addVisitor(String visitorId) {
        visitors.add(visitorId);
    }
}
