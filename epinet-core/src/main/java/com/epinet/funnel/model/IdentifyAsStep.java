package com.epinet.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/** Matches belief events whose object is one of {@link #values()}. */
@JsonInclude(Include.NON_NULL)
public record IdentifyAsStep(List<String> values, String title) implements FunnelStep {

    public IdentifyAsStep {
        values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public GateType gateType() {
        return GateType.IDENTIFY_AS;
    }
}
