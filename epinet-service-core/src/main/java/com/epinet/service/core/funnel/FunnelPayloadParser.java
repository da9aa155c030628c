package com.epinet.service.core.funnel;

import com.epinet.funnel.model.BeliefStep;
import com.epinet.funnel.model.CommitmentActionStep;
import com.epinet.funnel.model.ConversionActionStep;
import com.epinet.funnel.model.Funnel;
import com.epinet.funnel.model.FunnelStep;
import com.epinet.funnel.model.GateType;
import com.epinet.funnel.model.IdentifyAsStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a stored {@code options_payload} into typed funnel steps.
 *
 * <p>The payload is either a bare array of steps or an object {@code {steps: [...], promoted: bool}}.
 * Every step must carry a known {@code gateType}. Any mismatch yields a funnel without steps; the
 * failure is logged and never raised.
 */
@Component
@Slf4j
public class FunnelPayloadParser {

    private final ObjectMapper mapper;

    public FunnelPayloadParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Funnel parse(String id, String title, String payload) {
        if (payload == null || payload.isBlank()) {
            return Funnel.withoutSteps(id, title, false);
        }
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable options_payload for funnel {}: {}", id, ex.getOriginalMessage());
            return Funnel.withoutSteps(id, title, false);
        }
        boolean promoted = root != null && root.isObject() && root.path("promoted").asBoolean(false);
        JsonNode stepsNode = root != null && root.isObject() ? root.get("steps") : root;
        if (stepsNode == null || stepsNode.isNull()) {
            return Funnel.withoutSteps(id, title, promoted);
        }
        try {
            return new Funnel(id, title, readSteps(stepsNode), promoted);
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid step definitions for funnel {}: {}", id, ex.getMessage());
            return Funnel.withoutSteps(id, title, promoted);
        }
    }

    private List<FunnelStep> readSteps(JsonNode stepsNode) {
        if (!stepsNode.isArray()) {
            throw new IllegalArgumentException("steps must be an array");
        }
        List<FunnelStep> steps = new ArrayList<>(stepsNode.size());
        int position = 0;
        for (JsonNode stepNode : stepsNode) {
            steps.add(readStep(stepNode, position++));
        }
        return steps;
    }

    private FunnelStep readStep(JsonNode node, int position) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("step " + position + " is not an object");
        }
        String rawGate = text(node.get("gateType"));
        GateType gateType = GateType.fromWireName(rawGate)
                .orElseThrow(() -> new IllegalArgumentException("step " + position + " has unknown gateType " + rawGate));
        List<String> values = stringList(node.get("values"), "values", position);
        String title = text(node.get("title"));
        return switch (gateType) {
            case BELIEF -> new BeliefStep(values, title);
            case IDENTIFY_AS -> new IdentifyAsStep(values, title);
            case COMMITMENT_ACTION -> new CommitmentActionStep(
                    values, title, text(node.get("objectType")), stringList(node.get("objectIds"), "objectIds", position));
            case CONVERSION_ACTION -> new ConversionActionStep(
                    values, title, text(node.get("objectType")), stringList(node.get("objectIds"), "objectIds", position));
        };
    }

    private static List<String> stringList(JsonNode node, String field, int position) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("step " + position + " field " + field + " must be an array");
        }
        List<String> result = new ArrayList<>(node.size());
        for (JsonNode value : node) {
            if (value == null || value.isNull() || value.isContainerNode()) {
                continue;
            }
            String s = value.asText();
            if (!s.isEmpty()) {
                result.add(s);
            }
        }
        return result;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String s = node.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
