package com.epinet.service.core.aggregation;

import com.epinet.funnel.model.ActionStep;
import com.epinet.funnel.model.FunnelStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic node ids and labels for (step, content) pairs. Ids must stay stable across runs so
 * incremental merges line up.
 */
public final class NodeIdentity {

    /** Content id used by belief and identify-as nodes, which carry no content of their own. */
    public static final String NO_CONTENT_ID = "none";

    public static final String UNKNOWN_CONTENT = "Unknown Content";

    private NodeIdentity() {}

    public static String nodeId(FunnelStep step, String contentId) {
        List<String> parts = new ArrayList<>(4);
        parts.add(step.gateType().wireName());
        if (step instanceof ActionStep action) {
            parts.add(action.objectType() == null ? "" : action.objectType());
        }
        String first = step.firstValue();
        if (first != null) {
            parts.add(first);
        }
        parts.add(contentId == null ? NO_CONTENT_ID : contentId);
        return String.join("-", parts);
    }

    public static String nodeName(FunnelStep step, String contentId, Map<String, String> contentTitles) {
        return switch (step.gateType()) {
            case BELIEF -> "Believes: " + stepLabel(step);
            case IDENTIFY_AS -> "Identifies as: " + stepLabel(step);
            case COMMITMENT_ACTION, CONVERSION_ACTION -> {
                String verb = step.firstValue() == null ? "" : step.firstValue();
                yield verb + ": " + contentTitle(contentId, contentTitles);
            }
        };
    }

    private static String stepLabel(FunnelStep step) {
        if (step.title() != null && !step.title().isBlank()) {
            return step.title();
        }
        return String.join("/", step.values());
    }

    private static String contentTitle(String contentId, Map<String, String> contentTitles) {
        if (contentId == null || contentTitles == null) {
            return UNKNOWN_CONTENT;
        }
        String title = contentTitles.get(contentId);
        return title == null || title.isBlank() ? UNKNOWN_CONTENT : title;
    }
}
