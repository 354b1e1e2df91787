package com.tournament.analytics.domain.exception;

public class AnalyticsValidationException extends AnalyticsException {

    public AnalyticsValidationException(String message) {
        super(message);
    }

    public static void requireHorizon(int months) {
        if (months < 1 || months > 12) {
            throw new AnalyticsValidationException("Forecast horizon must be between 1 and 12 months, got " + months);
        }
    }
}
