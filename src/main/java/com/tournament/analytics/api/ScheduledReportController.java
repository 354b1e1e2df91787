package com.tournament.analytics.api;

import com.tournament.analytics.domain.model.report.ScheduledReportRequest;
import com.tournament.analytics.domain.service.report.ScheduledReportService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.job.AnalyticsJobProcessor;
import com.tournament.analytics.job.payload.ScheduledReportJobPayload;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scheduled report management.
 *
 * Endpoints:
 * - GET /api/v1/analytics/reports - List the tenant's reports
 * - POST /api/v1/analytics/reports - Create a report
 * - GET /api/v1/analytics/reports/{reportId} - Get a report
 * - PUT /api/v1/analytics/reports/{reportId} - Update a report
 * - DELETE /api/v1/analytics/reports/{reportId} - Soft-delete a report
 * - GET /api/v1/analytics/reports/{reportId}/history - Delivery history
 * - POST /api/v1/analytics/reports/{reportId}/run - Queue an immediate run
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics/reports")
@RequiredArgsConstructor
public class ScheduledReportController {

    static final String USER_HEADER = "X-User-Id";

    private final ScheduledReportService scheduledReportService;
    private final AnalyticsJobProcessor jobProcessor;

    @GetMapping
    public ResponseEntity<List<ScheduledReportEntity>> listReports(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId) {
        return ResponseEntity.ok(scheduledReportService.getScheduledReports(tenantId));
    }

    @PostMapping
    public ResponseEntity<ScheduledReportEntity> createReport(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ScheduledReportRequest request) {

        log.info("Create scheduled report: tenant={}, name={}", tenantId, request.getName());
        ScheduledReportEntity report = scheduledReportService.createScheduledReport(tenantId, userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    @GetMapping("/{reportId}")
    public ResponseEntity<ScheduledReportEntity> getReport(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @PathVariable UUID reportId) {
        return ResponseEntity.ok(scheduledReportService.getScheduledReport(tenantId, reportId));
    }

    /**
     * Partial update: omitted fields keep their value, so the body is not bean-validated.
     */
    @PutMapping("/{reportId}")
    public ResponseEntity<ScheduledReportEntity> updateReport(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @PathVariable UUID reportId,
            @RequestBody ScheduledReportRequest request) {

        log.info("Update scheduled report: tenant={}, reportId={}", tenantId, reportId);
        return ResponseEntity.ok(scheduledReportService.updateScheduledReport(tenantId, reportId, request));
    }

    @DeleteMapping("/{reportId}")
    public ResponseEntity<Void> deleteReport(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @PathVariable UUID reportId) {

        log.info("Delete scheduled report: tenant={}, reportId={}", tenantId, reportId);
        scheduledReportService.deleteScheduledReport(tenantId, reportId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{reportId}/history")
    public ResponseEntity<List<ReportDeliveryEntity>> getHistory(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @PathVariable UUID reportId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(scheduledReportService.getReportHistory(tenantId, reportId, limit));
    }

    @PostMapping("/{reportId}/run")
    public ResponseEntity<Map<String, UUID>> runReport(
            @RequestHeader(AnalyticsController.TENANT_HEADER) String tenantId,
            @PathVariable UUID reportId) {

        ScheduledReportEntity report = scheduledReportService.getScheduledReport(tenantId, reportId);
        UUID jobId = jobProcessor.submitJob(JobType.SCHEDULED_REPORT, ScheduledReportJobPayload.builder()
                .reportId(report.getId())
                .tenantId(tenantId)
                .build());

        log.info("Queued manual run of report {} (job {})", reportId, jobId);
        return ResponseEntity.accepted().body(Map.of("jobId", jobId));
    }
}
