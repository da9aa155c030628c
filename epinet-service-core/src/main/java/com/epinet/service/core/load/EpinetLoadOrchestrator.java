package com.epinet.service.core.load;

import com.epinet.funnel.model.Funnel;
import com.epinet.service.core.aggregation.AggregationProgressListener;
import com.epinet.service.core.aggregation.ChunkResult;
import com.epinet.service.core.aggregation.FunnelAggregator;
import com.epinet.service.core.aggregation.HourlyEpinetData;
import com.epinet.service.core.config.EpinetProperties;
import com.epinet.service.core.content.ContentTitleResolver;
import com.epinet.service.core.funnel.FunnelDefinitionService;
import com.epinet.service.core.store.EpinetStore;
import com.epinet.service.core.telemetry.EpinetLoadTelemetry;
import com.epinet.service.core.time.HourBucketer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives aggregation runs per tenant: guards against duplicate and too-frequent refreshes, processes
 * hour chunks recent-first, merges each finished chunk into the store, trims expired hours and keeps
 * progress and error state for status queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EpinetLoadOrchestrator {

    private final FunnelDefinitionService funnelDefinitions;
    private final ContentTitleResolver contentTitles;
    private final FunnelAggregator aggregator;
    private final EpinetStore store;
    private final LoadStateRegistry states;
    private final LoadPlanner planner;
    private final HourBucketer bucketer;
    private final EpinetProperties properties;
    private final EpinetLoadTelemetry telemetry;
    private final EpinetLoadExecutor executor;
    private final Clock clock;

    /** Plans the run from the store's state once it starts. */
    public RefreshOutcome requestRefresh(String tenantId) {
        return requestRefresh(tenantId, null);
    }

    /**
     * Starts a background run unless one is active for the tenant or the last attempt is within the
     * throttle interval. Guarded calls return without side effects.
     *
     * @param plan explicit plan, or {@code null} to let {@link LoadPlanner} decide
     */
    public RefreshOutcome requestRefresh(String tenantId, LoadPlan plan) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must be provided");
        }
        TenantLoadState state = states.state(tenantId);
        RefreshOutcome outcome = state.tryBegin(clock.instant(), properties.getLoad().getThrottle());
        switch (outcome) {
            case ALREADY_LOADING -> {
                telemetry.recordAlreadyLoading(tenantId);
                log.debug("Refresh for tenant {} skipped: already loading", tenantId);
                return outcome;
            }
            case THROTTLED -> {
                telemetry.recordThrottled(tenantId);
                log.debug("Refresh for tenant {} skipped: throttled", tenantId);
                return outcome;
            }
            default -> {}
        }
        try {
            executor.execute(() -> run(tenantId, plan, state));
        } catch (RuntimeException ex) {
            log.error("Could not schedule epinet load for tenant {}", tenantId, ex);
            state.fail(ex);
            telemetry.recordRunFailed(tenantId);
            return RefreshOutcome.REJECTED;
        }
        return RefreshOutcome.STARTED;
    }

    public LoadStatus getLoadStatus(String tenantId) {
        return states.find(tenantId).map(TenantLoadState::snapshot).orElseGet(LoadStatus::idle);
    }

    public boolean isLoading(String tenantId) {
        return states.find(tenantId).map(TenantLoadState::isLoading).orElse(false);
    }

    void run(String tenantId, LoadPlan requested, TenantLoadState state) {
        Instant started = clock.instant();
        telemetry.recordRunStarted(tenantId);
        Throwable failure = null;
        try {
            LoadPlan plan = requested != null ? requested : planner.plan(tenantId);
            List<Funnel> funnels = funnelDefinitions.loadFunnels(tenantId);
            Map<String, String> titles = contentTitles.titlesFor(tenantId);
            List<List<String>> chunks = planner.chunks(plan);
            log.info(
                    "Epinet load started tenant={} mode={} hours={} funnels={} chunks={}",
                    tenantId,
                    plan.mode(),
                    plan.hours(),
                    funnels.size(),
                    chunks.size());

            state.startProgress(funnels.size() * chunks.size());
            AggregationProgressListener listener = new AggregationProgressListener() {
                @Override
                public void funnelStarted(String funnelId) {
                    state.funnelStarted(funnelId);
                }

                @Override
                public void funnelCompleted(String funnelId) {
                    state.funnelCompleted(funnelId);
                }
            };

            for (int i = 0; i < chunks.size(); i++) {
                if (i > 0) {
                    pause();
                }
                List<String> chunk = chunks.get(i);
                ChunkResult result = aggregator.aggregate(tenantId, chunk, funnels, titles, listener);
                merge(tenantId, result);
                if (log.isDebugEnabled()) {
                    log.debug(
                            "Epinet chunk merged tenant={} hours={}..{} beliefRows={} actionRows={} skipped={}",
                            tenantId,
                            chunk.get(chunk.size() - 1),
                            chunk.get(0),
                            result.beliefRows(),
                            result.actionRows(),
                            result.skippedRows());
                }
            }

            if (plan.mode() == RunMode.FULL_RANGE) {
                trim(tenantId, funnels);
            }
            // newest hour the run read, so an hour closed mid-run is reloaded by the next plan
            store.markRefreshed(tenantId, chunks.get(0).get(0), clock.instant());
            state.complete();
            Duration elapsed = Duration.between(started, clock.instant());
            telemetry.recordRunSucceeded(tenantId, elapsed);
            log.info("Epinet load finished tenant={} mode={} elapsedMs={}", tenantId, plan.mode(), elapsed.toMillis());
        } catch (Exception ex) {
            failure = ex;
        } catch (Error err) {
            failure = err;
            throw err;
        } finally {
            if (failure != null) {
                log.error("Epinet load failed for tenant {}", tenantId, failure);
                state.fail(failure);
                telemetry.recordRunFailed(tenantId);
            }
        }
    }

    private void merge(String tenantId, ChunkResult result) {
        for (Map.Entry<String, Map<String, HourlyEpinetData>> funnel :
                result.byFunnel().entrySet()) {
            funnel.getValue().forEach((hourKey, data) -> store.put(tenantId, funnel.getKey(), hourKey, data));
        }
    }

    /** Deletes hours outside the retention window and funnels that no longer exist. */
    void trim(String tenantId, List<Funnel> funnels) {
        Set<String> window = new HashSet<>(bucketer.hourKeysForRange(properties.getLoad().getMaxAnalyticsHours()));
        Set<String> liveFunnels = new HashSet<>();
        funnels.forEach(funnel -> liveFunnels.add(funnel.id()));
        long removed = 0;
        for (String funnelId : store.funnelIds(tenantId)) {
            boolean live = liveFunnels.contains(funnelId);
            for (String hourKey : store.hourKeys(tenantId, funnelId)) {
                if (!live || !window.contains(hourKey)) {
                    store.delete(tenantId, funnelId, hourKey);
                    removed++;
                }
            }
        }
        telemetry.recordHoursTrimmed(removed);
        if (removed > 0) {
            log.info("Trimmed {} expired epinet hours for tenant {}", removed, tenantId);
        }
    }

    private void pause() {
        Duration pause = properties.getLoad().getChunkPause();
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between epinet load chunks", ie);
        }
    }
}
