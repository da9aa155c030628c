package com.epinet.funnel.model;

import java.util.List;

/**
 * Gate matched against content action events. Commitment and conversion actions share matching
 * semantics and differ only by tag.
 */
public interface ActionStep extends FunnelStep {

    /** Required action object type, {@code null} when any type matches. */
    String objectType();

    /** Allowed action object ids, empty when any id matches. */
    List<String> objectIds();

    default boolean constrainsObjectType() {
        return objectType() != null && !objectType().isEmpty();
    }

    default boolean constrainsObjectIds() {
        return objectIds() != null && !objectIds().isEmpty();
    }
}
