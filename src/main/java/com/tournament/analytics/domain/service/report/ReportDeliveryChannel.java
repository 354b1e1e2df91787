package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.model.report.ReportAttachment;

import java.time.Instant;
import java.util.List;

/**
 * Sends a rendered report to its recipients. Implementations throw
 * {@link com.tournament.analytics.domain.exception.ReportDeliveryException} when the
 * report was not delivered.
 */
public interface ReportDeliveryChannel {

    Instant deliver(List<String> recipients, String subject, ReportAttachment attachment);
}
