package com.epinet.service.core.load;

import java.time.Duration;
import java.time.Instant;

/**
 * Loading flag, throttle marker, error and progress for one tenant. All access is synchronized on
 * the instance so the guard check and the transition to loading happen atomically.
 */
public final class TenantLoadState {
    private boolean loading;
    private Instant lastAttempt;
    private String error;
    private int total;
    private int completed;
    private String currentFunnelId;

    synchronized RefreshOutcome tryBegin(Instant now, Duration throttle) {
        if (loading) {
            return RefreshOutcome.ALREADY_LOADING;
        }
        if (lastAttempt != null && now.isBefore(lastAttempt.plus(throttle))) {
            return RefreshOutcome.THROTTLED;
        }
        loading = true;
        lastAttempt = now;
        error = null;
        total = 0;
        completed = 0;
        currentFunnelId = null;
        return RefreshOutcome.STARTED;
    }

    synchronized void startProgress(int totalUnits) {
        total = Math.max(0, totalUnits);
        completed = 0;
        currentFunnelId = null;
    }

    synchronized void funnelStarted(String funnelId) {
        currentFunnelId = funnelId;
    }

    synchronized void funnelCompleted(String funnelId) {
        currentFunnelId = funnelId;
        if (completed < total) {
            completed++;
        }
    }

    synchronized void complete() {
        loading = false;
        completed = total;
        currentFunnelId = null;
    }

    synchronized void fail(Throwable cause) {
        loading = false;
        error = describe(cause);
    }

    synchronized boolean isLoading() {
        return loading;
    }

    synchronized LoadStatus snapshot() {
        return new LoadStatus(loading, lastAttempt, error, LoadStatus.Progress.of(total, completed, currentFunnelId));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
