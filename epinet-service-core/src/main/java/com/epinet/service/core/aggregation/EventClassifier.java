package com.epinet.service.core.aggregation;

import com.epinet.funnel.model.ActionStep;
import com.epinet.funnel.model.FunnelStep;
import com.epinet.service.core.event.ActionEventRow;
import com.epinet.service.core.event.BeliefEventRow;

/**
 * Decides whether a raw event row satisfies a funnel step. Evaluated per (funnel, step) pair since
 * step semantics are funnel-local.
 */
public final class EventClassifier {

    private EventClassifier() {}

    public static boolean matchBelief(BeliefEventRow row, FunnelStep step) {
        if (row == null || step == null) {
            return false;
        }
        return switch (step.gateType()) {
            case BELIEF -> row.verb() != null && step.values().contains(row.verb());
            case IDENTIFY_AS -> row.object() != null && step.values().contains(row.object());
            default -> false;
        };
    }

    public static boolean matchAction(ActionEventRow row, FunnelStep step) {
        if (row == null || !(step instanceof ActionStep action)) {
            return false;
        }
        if (row.verb() == null || !action.values().contains(row.verb())) {
            return false;
        }
        if (action.constrainsObjectType() && !action.objectType().equals(row.objectType())) {
            return false;
        }
        return !action.constrainsObjectIds() || action.objectIds().contains(row.objectId());
    }
}
