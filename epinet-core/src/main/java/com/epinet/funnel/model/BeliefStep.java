package com.epinet.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/** Matches held-belief events whose verb is one of {@link #values()}. */
@JsonInclude(Include.NON_NULL)
public record BeliefStep(List<String> values, String title) implements FunnelStep {

    public BeliefStep {
        values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public GateType gateType() {
        return GateType.BELIEF;
    }
}
