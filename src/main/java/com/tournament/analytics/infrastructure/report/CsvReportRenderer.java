package com.tournament.analytics.infrastructure.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.model.report.ReportData;
import com.tournament.analytics.domain.service.report.ReportRenderer;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity.ReportFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens each report section into {@code section,metric,value} rows. Nested fields use
 * dotted paths and list elements an index, e.g. {@code cohorts[0].cohortSize}.
 */
@Component
@RequiredArgsConstructor
public class CsvReportRenderer implements ReportRenderer {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(Row.class).withHeader();

    private final ObjectMapper objectMapper;

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public String contentType() {
        return "text/csv";
    }

    @Override
    public String fileExtension() {
        return "csv";
    }

    @Override
    public byte[] render(ReportData data) {
        List<Row> rows = new ArrayList<>();
        rows.add(new Row("report", "tenantId", data.getTenantId()));
        rows.add(new Row("report", "name", data.getReportName()));
        rows.add(new Row("report", "periodStart", String.valueOf(data.getPeriodStart())));
        rows.add(new Row("report", "periodEnd", String.valueOf(data.getPeriodEnd())));

        addSection(rows, "summary", data.getSummary());
        addSection(rows, "revenue", data.getRevenue());
        addSection(rows, "users", data.getUsers());
        addSection(rows, "cohorts", data.getCohorts());
        addSection(rows, "tournaments", data.getTournaments());
        addSection(rows, "predictions", data.getPredictions());

        try {
            return CSV_MAPPER.writer(SCHEMA).writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new ReportDeliveryException("Failed to render CSV report", e);
        }
    }

    private void addSection(List<Row> rows, String section, Object value) {
        if (value == null) {
            return;
        }
        flatten(rows, section, "", objectMapper.valueToTree(value));
    }

    private static void flatten(List<Row> rows, String section, String path, JsonNode node) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(rows, section, path.isEmpty() ? field.getKey() : path + "." + field.getKey(), field.getValue());
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(rows, section, path + "[" + i + "]", node.get(i));
            }
        } else if (node.isBigDecimal()) {
            rows.add(new Row(section, path, node.decimalValue().toPlainString()));
        } else if (!node.isNull()) {
            rows.add(new Row(section, path, node.asText()));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"section", "metric", "value"})
    static class Row {
        private String section;
        private String metric;
        private String value;
    }
}
