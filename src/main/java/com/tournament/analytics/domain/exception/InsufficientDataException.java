package com.tournament.analytics.domain.exception;

import lombok.Getter;

import java.util.Locale;

/**
 * A forecast or prediction was requested with fewer historical points than it needs.
 */
@Getter
public class InsufficientDataException extends AnalyticsException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String subject, int required, int actual) {
        super(String.format(Locale.ROOT, "Insufficient data for %s: need at least %d points, got %d",
                subject, required, actual));
        this.required = required;
        this.actual = actual;
    }
}
