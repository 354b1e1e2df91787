package com.tournament.analytics.domain.model.cohort;

public enum RetentionTrend {
    IMPROVING,
    DECLINING,
    STABLE;

    /**
     * Classifies a regression slope, in percentage points per cohort.
     */
    public static RetentionTrend fromSlope(double slope) {
        if (slope > 0.5) {
            return IMPROVING;
        }
        if (slope < -0.5) {
            return DECLINING;
        }
        return STABLE;
    }
}
