package com.epinet.service.core.load;

public record LoadPlan(RunMode mode, int hours) {

    public LoadPlan {
        if (mode == null) {
            throw new IllegalArgumentException("mode must be provided");
        }
        if (hours < 1) {
            throw new IllegalArgumentException("hours must be positive: " + hours);
        }
    }

    public static LoadPlan currentHour() {
        return new LoadPlan(RunMode.CURRENT_HOUR, 1);
    }

    public static LoadPlan fullRange(int hours) {
        return new LoadPlan(RunMode.FULL_RANGE, hours);
    }
}
