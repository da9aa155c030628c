package com.epinet.service.core.load;

import java.time.Instant;

/** Point-in-time view of a tenant's load state. {@code error} is {@code null} after a clean run. */
public record LoadStatus(boolean loading, Instant lastAttempt, String error, Progress progress) {

    public static LoadStatus idle() {
        return new LoadStatus(false, null, null, Progress.of(0, 0, null));
    }

    public record Progress(int total, int completed, String currentFunnelId, int percentComplete) {

        public static Progress of(int total, int completed, String currentFunnelId) {
            int percent = total <= 0 ? 0 : (int) Math.round(completed * 100.0d / total);
            return new Progress(total, completed, currentFunnelId, Math.min(100, percent));
        }
    }
}
