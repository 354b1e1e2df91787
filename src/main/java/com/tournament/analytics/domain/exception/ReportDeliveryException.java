package com.tournament.analytics.domain.exception;

/**
 * A report could not be rendered or handed to its delivery channel.
 */
public class ReportDeliveryException extends AnalyticsException {

    public ReportDeliveryException(String message) {
        super(message);
    }

    public ReportDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
