package com.tournament.analytics.domain.model;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT;

    /**
     * Direction of a percentage change with a symmetric dead band.
     */
    public static TrendDirection of(double changePercent, double deadBand) {
        if (Math.abs(changePercent) < deadBand) {
            return FLAT;
        }
        return changePercent > 0 ? UP : DOWN;
    }
}
