package com.tournament.analytics.domain.service;

import java.util.List;

/**
 * Descriptive statistics over small in-memory series.
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation (divides by n).
     */
    public static double populationStdDev(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += Math.pow(value - mean, 2);
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * Least-squares slope of the series against its indices 0..n-1; 0 for fewer than 2 points.
     */
    public static double indexSlope(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double sumX = n * (n - 1) / 2.0;
        double sumX2 = n * (n - 1) * (2.0 * n - 1) / 6.0;
        double sumY = 0;
        double sumXY = 0;
        for (int i = 0; i < n; i++) {
            sumY += values.get(i);
            sumXY += i * values.get(i);
        }
        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }

    /**
     * Percentage change from {@code previous} to {@code current}. A zero baseline yields 100
     * when the current value is positive, otherwise 0.
     */
    public static double percentChange(double current, double previous) {
        if (previous == 0) {
            return current > 0 ? 100.0 : 0.0;
        }
        return (current - previous) / previous * 100.0;
    }
}
