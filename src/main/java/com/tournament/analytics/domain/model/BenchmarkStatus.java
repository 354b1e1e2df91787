package com.tournament.analytics.domain.model;

public enum BenchmarkStatus {
    ABOVE,
    AT,
    BELOW,
    UNAVAILABLE;

    public static BenchmarkStatus compare(Double actual, double target, double tolerance) {
        if (actual == null) {
            return UNAVAILABLE;
        }
        if (actual > target + tolerance) {
            return ABOVE;
        }
        if (actual < target - tolerance) {
            return BELOW;
        }
        return AT;
    }
}
