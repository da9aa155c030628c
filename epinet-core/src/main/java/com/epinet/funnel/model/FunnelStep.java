package com.epinet.funnel.model;

import java.util.List;

/**
 * One gate of a funnel. Implementations are immutable and tagged by {@link #gateType()}.
 */
public interface FunnelStep {

    GateType gateType();

    /** Match values: verbs for belief and action gates, objects for identify-as gates. */
    List<String> values();

    /** Optional display title, may be {@code null}. */
    String title();

    default String firstValue() {
        List<String> values = values();
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
