package com.epinet.funnel.model;

import java.util.List;

/**
 * A stored funnel ("epinet"). Step order defines the 1-based step index used for transition
 * direction.
 */
public record Funnel(String id, String title, List<FunnelStep> steps, boolean promoted) {

    public Funnel {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Funnel id must be provided");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Funnel withoutSteps(String id, String title, boolean promoted) {
        return new Funnel(id, title, List.of(), promoted);
    }

    /** Returns the 1-based index of the step at the given list position. */
    public int stepIndexOf(int position) {
        return position + 1;
    }

    public boolean hasSteps() {
        return !steps.isEmpty();
    }
}
