package com.epinet.service.core.event;

import com.epinet.funnel.model.ActionStep;
import com.epinet.funnel.model.Funnel;
import com.epinet.funnel.model.FunnelStep;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Union of every match criterion across a set of funnels, so raw events can be fetched with one
 * belief query and one action query per time chunk.
 *
 * <p>{@code actionObjectTypes} and {@code actionObjectIds} are empty unless every action step
 * constrains them; a single unconstrained step would otherwise lose rows it should match.
 */
public record EventCriteria(
        Set<String> beliefVerbs,
        Set<String> identifyAsObjects,
        Set<String> actionVerbs,
        Set<String> actionObjectTypes,
        Set<String> actionObjectIds) {

    public EventCriteria {
        beliefVerbs = Set.copyOf(beliefVerbs);
        identifyAsObjects = Set.copyOf(identifyAsObjects);
        actionVerbs = Set.copyOf(actionVerbs);
        actionObjectTypes = Set.copyOf(actionObjectTypes);
        actionObjectIds = Set.copyOf(actionObjectIds);
    }

    public static EventCriteria from(Collection<Funnel> funnels) {
        Set<String> beliefVerbs = new LinkedHashSet<>();
        Set<String> identifyAsObjects = new LinkedHashSet<>();
        Set<String> actionVerbs = new LinkedHashSet<>();
        Set<String> objectTypes = new LinkedHashSet<>();
        Set<String> objectIds = new LinkedHashSet<>();
        boolean everyActionTyped = true;
        boolean everyActionIdScoped = true;
        for (Funnel funnel : funnels) {
            for (FunnelStep step : funnel.steps()) {
                switch (step.gateType()) {
                    case BELIEF -> beliefVerbs.addAll(step.values());
                    case IDENTIFY_AS -> identifyAsObjects.addAll(step.values());
                    case COMMITMENT_ACTION, CONVERSION_ACTION -> {
                        ActionStep action = (ActionStep) step;
                        if (action.values().isEmpty()) {
                            continue;
                        }
                        actionVerbs.addAll(action.values());
                        if (action.constrainsObjectType()) {
                            objectTypes.add(action.objectType());
                        } else {
                            everyActionTyped = false;
                        }
                        if (action.constrainsObjectIds()) {
                            objectIds.addAll(action.objectIds());
                        } else {
                            everyActionIdScoped = false;
                        }
                    }
                }
            }
        }
        return new EventCriteria(
                beliefVerbs,
                identifyAsObjects,
                actionVerbs,
                everyActionTyped ? objectTypes : Set.of(),
                everyActionIdScoped ? objectIds : Set.of());
    }

    public boolean hasBeliefCriteria() {
        return !beliefVerbs.isEmpty() || !identifyAsObjects.isEmpty();
    }

    public boolean hasActionCriteria() {
        return !actionVerbs.isEmpty();
    }
}
