package com.epinet.service.core.aggregation;

/** Callback for per-funnel progress while a chunk's transitions are inferred. */
@FunctionalInterface
public interface AggregationProgressListener {

    AggregationProgressListener NONE = funnelId -> {};

    default void funnelStarted(String funnelId) {}

    void funnelCompleted(String funnelId);
}
