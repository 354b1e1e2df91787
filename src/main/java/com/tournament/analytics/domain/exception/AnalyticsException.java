package com.tournament.analytics.domain.exception;

/**
 * Base type for analytics failures that callers are expected to handle.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
