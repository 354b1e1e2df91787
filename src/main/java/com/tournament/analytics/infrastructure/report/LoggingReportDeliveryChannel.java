package com.tournament.analytics.infrastructure.report;

import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.model.report.ReportAttachment;
import com.tournament.analytics.domain.service.report.ReportDeliveryChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Default channel: records the delivery in the application log instead of sending mail.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingReportDeliveryChannel implements ReportDeliveryChannel {

    private final Clock clock;

    @Override
    public Instant deliver(List<String> recipients, String subject, ReportAttachment attachment) {
        if (recipients == null || recipients.isEmpty()) {
            throw new ReportDeliveryException("Report has no recipients");
        }
        log.info("Delivering report '{}' to {} ({}, {} bytes)",
                subject, recipients, attachment.getFilename(), attachment.size());
        return clock.instant();
    }
}
