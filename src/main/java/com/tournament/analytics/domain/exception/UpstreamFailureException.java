package com.tournament.analytics.domain.exception;

/**
 * Data store or other collaborator failure surfaced to the caller.
 */
public class UpstreamFailureException extends AnalyticsException {

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
