package com.tournament.analytics.infrastructure.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.model.report.ReportData;
import com.tournament.analytics.domain.service.report.ReportRenderer;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity.ReportFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public String contentType() {
        return "application/json";
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public byte[] render(ReportData data) {
        try {
            return objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw new ReportDeliveryException("Failed to render JSON report", e);
        }
    }
}
