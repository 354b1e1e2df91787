package com.tournament.analytics.domain.exception;

/**
 * No aggregate, cohort or record exists for the requested key.
 *
 * A zero-activity period has a zero-valued row and never raises this.
 */
public class NotFoundException extends AnalyticsException {

    public NotFoundException(String message) {
        super(message);
    }
}
