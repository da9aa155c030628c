package com.epinet.service.core.aggregation;

import static org.assertj.core.api.Assertions.assertThat;

import com.epinet.funnel.model.BeliefStep;
import com.epinet.funnel.model.CommitmentActionStep;
import com.epinet.funnel.model.ConversionActionStep;
import com.epinet.funnel.model.IdentifyAsStep;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeIdentityTest {

    @Test
    void beliefNodesUseSentinelContentId() {
        BeliefStep step = new BeliefStep(List.of("Yes", "Maybe"), null);

        assertThat(NodeIdentity.nodeId(step, NodeIdentity.NO_CONTENT_ID)).isEqualTo("belief-Yes-none");
        assertThat(NodeIdentity.nodeName(step, NodeIdentity.NO_CONTENT_ID, Map.of()))
                .isEqualTo("Believes: Yes/Maybe");
        assertThat(NodeIdentity.nodeName(new BeliefStep(List.of("Yes"), "Agrees"), null, Map.of()))
                .isEqualTo("Believes: Agrees");
    }

    @Test
    void identifyAsNodesLabelTheIdentity() {
        IdentifyAsStep step = new IdentifyAsStep(List.of("Developer"), null);

        assertThat(NodeIdentity.nodeId(step, NodeIdentity.NO_CONTENT_ID)).isEqualTo("identifyAs-Developer-none");
        assertThat(NodeIdentity.nodeName(step, NodeIdentity.NO_CONTENT_ID, Map.of()))
                .isEqualTo("Identifies as: Developer");
    }

    @Test
    void actionNodesIncludeObjectTypeAndContent() {
        CommitmentActionStep typed = new CommitmentActionStep(List.of("CLICKED"), null, "Pane", null);
        ConversionActionStep untyped = new ConversionActionStep(List.of("SUBMITTED"), null, null, null);

        assertThat(NodeIdentity.nodeId(typed, "P1")).isEqualTo("commitmentAction-Pane-CLICKED-P1");
        assertThat(NodeIdentity.nodeId(untyped, "F1")).isEqualTo("conversionAction--SUBMITTED-F1");
        assertThat(NodeIdentity.nodeId(typed, "P2")).isNotEqualTo(NodeIdentity.nodeId(typed, "P1"));
    }

    @Test
    void actionNamesFallBackToPlaceholderTitle() {
        CommitmentActionStep step = new CommitmentActionStep(List.of("CLICKED"), null, "Pane", null);

        assertThat(NodeIdentity.nodeName(step, "P1", Map.of("P1", "Pricing"))).isEqualTo("CLICKED: Pricing");
        assertThat(NodeIdentity.nodeName(step, "P9", Map.of("P1", "Pricing"))).isEqualTo("CLICKED: Unknown Content");
        assertThat(NodeIdentity.nodeName(step, "P1", null)).isEqualTo("CLICKED: Unknown Content");
    }

    @Test
    void idsAreStableAcrossEquivalentSteps() {
        CommitmentActionStep first = new CommitmentActionStep(List.of("CLICKED"), "One", "Pane", List.of("P1"));
        CommitmentActionStep second = new CommitmentActionStep(List.of("CLICKED"), "Two", "Pane", List.of("P1"));

        assertThat(NodeIdentity.nodeId(first, "P1")).isEqualTo(NodeIdentity.nodeId(second, "P1"));
    }
}
