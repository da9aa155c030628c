package com.epinet.service.core.telemetry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Component
@Primary
public class EpinetLoadTelemetryRegistry implements EpinetLoadTelemetry {
    private final LongAdder runsStarted = new LongAdder();
    private final LongAdder runsSucceeded = new LongAdder();
    private final LongAdder runsFailed = new LongAdder();
    private final LongAdder throttled = new LongAdder();
    private final LongAdder alreadyLoading = new LongAdder();
    private final LongAdder beliefRows = new LongAdder();
    private final LongAdder actionRows = new LongAdder();
    private final LongAdder hoursTrimmed = new LongAdder();
    private final LongAdder runMillis = new LongAdder();

    private final Map<String, LongAdder> failuresByTenant = new ConcurrentHashMap<>();

    @Override
    public void recordRunStarted(String tenantId) {
        runsStarted.increment();
    }

    @Override
    public void recordRunSucceeded(String tenantId, Duration elapsed) {
        runsSucceeded.increment();
        if (elapsed != null) {
            runMillis.add(elapsed.toMillis());
        }
    }

    @Override
    public void recordRunFailed(String tenantId) {
        runsFailed.increment();
        failuresByTenant.computeIfAbsent(tenantId, key -> new LongAdder()).increment();
    }

    @Override
    public void recordThrottled(String tenantId) {
        throttled.increment();
    }

    @Override
    public void recordAlreadyLoading(String tenantId) {
        alreadyLoading.increment();
    }

    @Override
    public void recordRowsClassified(long beliefRowCount, long actionRowCount) {
        if (beliefRowCount > 0) {
            beliefRows.add(beliefRowCount);
        }
        if (actionRowCount > 0) {
            actionRows.add(actionRowCount);
        }
    }

    @Override
    public void recordHoursTrimmed(long hours) {
        if (hours > 0) {
            hoursTrimmed.add(hours);
        }
    }

    public Snapshot snapshot() {
        Map<String, Long> failures = new ConcurrentHashMap<>();
        failuresByTenant.forEach((tenant, adder) -> failures.put(tenant, adder.sum()));
        return new Snapshot(
                runsStarted.sum(),
                runsSucceeded.sum(),
                runsFailed.sum(),
                throttled.sum(),
                alreadyLoading.sum(),
                beliefRows.sum(),
                actionRows.sum(),
                hoursTrimmed.sum(),
                runMillis.sum(),
                Map.copyOf(failures));
    }

    public record Snapshot(
            long runsStarted,
            long runsSucceeded,
            long runsFailed,
            long throttled,
            long alreadyLoading,
            long beliefRows,
            long actionRows,
            long hoursTrimmed,
            long totalRunMillis,
            Map<String, Long> failuresByTenant) {}
}
