package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.model.report.ReportData;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity.ReportFormat;

/**
 * Serializes report content into one output format.
 */
public interface ReportRenderer {

    ReportFormat format();

    String contentType();

    String fileExtension();

    byte[] render(ReportData data);
}
