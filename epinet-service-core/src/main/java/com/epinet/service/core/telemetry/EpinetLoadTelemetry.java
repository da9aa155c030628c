package com.epinet.service.core.telemetry;

import java.time.Duration;

public interface EpinetLoadTelemetry {
    void recordRunStarted(String tenantId);

    void recordRunSucceeded(String tenantId, Duration elapsed);

    void recordRunFailed(String tenantId);

    void recordThrottled(String tenantId);

    void recordAlreadyLoading(String tenantId);

    void recordRowsClassified(long beliefRows, long actionRows);

    void recordHoursTrimmed(long hours);
}
