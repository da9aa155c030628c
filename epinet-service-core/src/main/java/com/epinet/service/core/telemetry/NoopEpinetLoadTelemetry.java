package com.epinet.service.core.telemetry;

import java.time.Duration;

public class NoopEpinetLoadTelemetry implements EpinetLoadTelemetry {
    @Override
    public void recordRunStarted(String tenantId) {}

    @Override
    public void recordRunSucceeded(String tenantId, Duration elapsed) {}

    @Override
    public void recordRunFailed(String tenantId) {}

    @Override
    public void recordThrottled(String tenantId) {}

    @Override
    public void recordAlreadyLoading(String tenantId) {}

    @Override
    public void recordRowsClassified(long beliefRows, long actionRows) {}

    @Override
    public void recordHoursTrimmed(long hours) {}
}
