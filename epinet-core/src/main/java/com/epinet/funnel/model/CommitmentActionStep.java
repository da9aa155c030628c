package com.epinet.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

@JsonInclude(Include.NON_NULL)
public record CommitmentActionStep(List<String> values, String title, String objectType, List<String> objectIds)
        implements ActionStep {

    public CommitmentActionStep {
        values = values == null ? List.of() : List.copyOf(values);
        objectIds = objectIds == null ? List.of() : List.copyOf(objectIds);
    }

    @Override
    public GateType gateType() {
        return GateType.COMMITMENT_ACTION;
    }
}
