package com.tournament.analytics.api;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.cohort.CohortAnalysis;
import com.tournament.analytics.domain.model.cohort.RetentionBenchmarks;
import com.tournament.analytics.domain.model.cohort.RetentionPrediction;
import com.tournament.analytics.domain.model.dashboard.AnalyticsHealth;
import com.tournament.analytics.domain.model.dashboard.CohortAnalytics;
import com.tournament.analytics.domain.model.dashboard.DashboardSummary;
import com.tournament.analytics.domain.model.dashboard.RevenueAnalytics;
import com.tournament.analytics.domain.model.dashboard.TournamentAnalytics;
import com.tournament.analytics.domain.model.forecast.RevenueForecast;
import com.tournament.analytics.domain.model.forecast.UserGrowthForecast;
import com.tournament.analytics.domain.model.tournament.AnalysisOptions;
import com.tournament.analytics.domain.model.tournament.AttendancePrediction;
import com.tournament.analytics.domain.model.tournament.FormatPopularity;
import com.tournament.analytics.domain.model.tournament.PlayerEngagement;
import com.tournament.analytics.domain.model.tournament.TournamentBenchmarks;
import com.tournament.analytics.domain.model.tournament.TournamentMetrics;
import com.tournament.analytics.domain.model.tournament.TournamentPerformance;
import com.tournament.analytics.domain.model.tournament.TournamentTrend;
import com.tournament.analytics.domain.service.AnalyticsOrchestrator;
import com.tournament.analytics.domain.service.report.ScheduledReportService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity;
import com.tournament.analytics.job.AnalyticsJobProcessor;
import com.tournament.analytics.job.payload.AggregationJobPayload;
import com.tournament.analytics.job.payload.CacheWarmJobPayload;
import com.tournament.analytics.job.payload.ScheduledReportJobPayload;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for tenant analytics. The tenant comes from the {@code X-Tenant-Id} header.
 *
 * Endpoints:
 * - GET /api/v1/analytics/dashboard - Headline KPIs and alerts
 * - GET /api/v1/analytics/health - Aggregate freshness and cache hit rate
 * - GET /api/v1/analytics/revenue - Revenue view of a month
 * - GET /api/v1/analytics/revenue/forecast - Revenue forecast
 * - GET /api/v1/analytics/users/forecast - User growth forecast
 * - GET /api/v1/analytics/cohorts - Recent cohorts with comparison
 * - GET /api/v1/analytics/tournaments - Tournament view of a month
 * - GET /api/v1/analytics/tournaments/* - Tournament analyses
 * - POST /api/v1/analytics/cache/refresh - Drop the tenant's cached analytics
 * - POST /api/v1/analytics/jobs - Submit a background job
 * - GET /api/v1/analytics/jobs/{jobId} - Get job status
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final AnalyticsOrchestrator orchestrator;
    private final AnalyticsJobProcessor jobProcessor;
    private final ScheduledReportService scheduledReportService;
    private final Clock clock;

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardSummary> getDashboard(@RequestHeader(TENANT_HEADER) String tenantId) {
        log.info("Dashboard summary: tenant={}", tenantId);
        return ResponseEntity.ok(orchestrator.getDashboardSummary(tenantId));
    }

    @GetMapping("/health")
    public ResponseEntity<AnalyticsHealth> getHealth(@RequestHeader(TENANT_HEADER) String tenantId) {
        return ResponseEntity.ok(orchestrator.getAnalyticsHealth(tenantId));
    }

    /**
     * GET /api/v1/analytics/revenue?month=2024-03-01
     *
     * Any date inside the month selects it; defaults to the current month.
     */
    @GetMapping("/revenue")
    public ResponseEntity<RevenueAnalytics> getRevenue(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate month) {

        log.info("Revenue analytics: tenant={}, month={}", tenantId, month);
        return ResponseEntity.ok(orchestrator.getRevenueAnalytics(tenantId, orToday(month)));
    }

    @GetMapping("/revenue/forecast")
    public ResponseEntity<RevenueForecast> getRevenueForecast(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(defaultValue = "6") int months) {

        log.info("Revenue forecast: tenant={}, months={}", tenantId, months);
        return ResponseEntity.ok(orchestrator.getRevenueForecast(tenantId, months));
    }

    @GetMapping("/users/forecast")
    public ResponseEntity<UserGrowthForecast> getUserGrowthForecast(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(defaultValue = "6") int months) {

        log.info("User growth forecast: tenant={}, months={}", tenantId, months);
        return ResponseEntity.ok(orchestrator.getUserGrowthForecast(tenantId, months));
    }

    @GetMapping("/cohorts")
    public ResponseEntity<CohortAnalytics> getCohorts(@RequestHeader(TENANT_HEADER) String tenantId) {
        log.info("Cohort analytics: tenant={}", tenantId);
        return ResponseEntity.ok(orchestrator.getCohortAnalytics(tenantId));
    }

    @GetMapping("/cohorts/benchmarks")
    public ResponseEntity<RetentionBenchmarks> getRetentionBenchmarks(@RequestHeader(TENANT_HEADER) String tenantId) {
        return ResponseEntity.ok(orchestrator.getRetentionBenchmarks(tenantId));
    }

    @GetMapping("/cohorts/{cohortMonth}")
    public ResponseEntity<CohortAnalysis> getCohort(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cohortMonth) {

        log.info("Cohort analysis: tenant={}, cohort={}", tenantId, cohortMonth);
        return ResponseEntity.ok(orchestrator.getCohortAnalysis(tenantId, cohortMonth.withDayOfMonth(1)));
    }

    @GetMapping("/cohorts/{cohortMonth}/prediction")
    public ResponseEntity<RetentionPrediction> getRetentionPrediction(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate cohortMonth,
            @RequestParam(defaultValue = "6") int months) {

        return ResponseEntity.ok(orchestrator.getRetentionPrediction(
                tenantId, cohortMonth.withDayOfMonth(1), months));
    }

    @GetMapping("/tournaments")
    public ResponseEntity<TournamentAnalytics> getTournaments(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate month) {

        log.info("Tournament analytics: tenant={}, month={}", tenantId, month);
        return ResponseEntity.ok(orchestrator.getTournamentAnalytics(tenantId, orToday(month)));
    }

    /**
     * GET /api/v1/analytics/tournaments/performance?periodType=WEEK&compareToPrevious=true
     */
    @GetMapping("/tournaments/performance")
    public ResponseEntity<TournamentPerformance> getTournamentPerformance(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(defaultValue = "MONTH") PeriodType periodType,
            @RequestParam(defaultValue = "false") boolean compareToPrevious,
            @RequestParam(defaultValue = "false") boolean includeFormatBreakdown) {

        AnalysisOptions options = AnalysisOptions.builder()
                .startDate(startDate)
                .endDate(endDate)
                .periodType(periodType)
                .compareToPrevious(compareToPrevious)
                .includeFormatBreakdown(includeFormatBreakdown)
                .build();
        return ResponseEntity.ok(orchestrator.getTournamentPerformance(tenantId, options));
    }

    @GetMapping("/tournaments/formats")
    public ResponseEntity<List<FormatPopularity>> getFormatPopularity(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        return ResponseEntity.ok(orchestrator.getFormatPopularity(tenantId, from, to));
    }

    @GetMapping("/tournaments/trends")
    public ResponseEntity<List<TournamentTrend>> getTournamentTrends(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(defaultValue = "MONTH") PeriodType periodType,
            @RequestParam(defaultValue = "6") int periods) {

        return ResponseEntity.ok(orchestrator.getTournamentTrends(tenantId, periodType, periods));
    }

    @GetMapping("/tournaments/metrics")
    public ResponseEntity<TournamentMetrics> getTournamentMetrics(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam(required = false) String tournamentId) {

        return ResponseEntity.ok(orchestrator.getTournamentMetrics(tenantId, tournamentId));
    }

    @GetMapping("/tournaments/attendance")
    public ResponseEntity<AttendancePrediction> getAttendancePrediction(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam String format,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        return ResponseEntity.ok(orchestrator.getAttendancePrediction(tenantId, format, date));
    }

    @GetMapping("/tournaments/engagement")
    public ResponseEntity<PlayerEngagement> getPlayerEngagement(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {

        return ResponseEntity.ok(orchestrator.getPlayerEngagement(tenantId, from, to));
    }

    @GetMapping("/tournaments/benchmarks")
    public ResponseEntity<TournamentBenchmarks> getTournamentBenchmarks(@RequestHeader(TENANT_HEADER) String tenantId) {
        return ResponseEntity.ok(orchestrator.getTournamentBenchmarks(tenantId));
    }

    @PostMapping("/cache/refresh")
    public ResponseEntity<Map<String, Long>> refreshCache(@RequestHeader(TENANT_HEADER) String tenantId) {
        log.info("Cache refresh: tenant={}", tenantId);
        return ResponseEntity.ok(Map.of("removed", orchestrator.refreshAnalytics(tenantId)));
    }

    /**
     * Submit a background job for the calling tenant.
     *
     * POST /api/v1/analytics/jobs
     *
     * Request body:
     * {
     *   "type": "AGGREGATION|SCHEDULED_REPORT|CACHE_WARM",
     *   "aggregationType": "REVENUE|COHORTS|TOURNAMENTS|ALL",
     *   "periodType": "DAY", "periodStart": "2024-03-01", "periodEnd": "2024-03-01",
     *   "reportId": "uuid"
     * }
     */
    @PostMapping("/jobs")
    public ResponseEntity<Map<String, UUID>> submitJob(
            @RequestHeader(TENANT_HEADER) String tenantId,
            @Valid @RequestBody JobSubmitRequest request) {

        log.info("Submit job: tenant={}, type={}", tenantId, request.getType());

        Object payload = switch (request.getType()) {
            case AGGREGATION -> AggregationJobPayload.builder()
                    .tenantId(tenantId)
                    .type(request.getAggregationType() != null
                            ? request.getAggregationType()
                            : AggregationJobPayload.AggregationType.ALL)
                    .periodType(request.getPeriodType())
                    .periodStart(request.getPeriodStart())
                    .periodEnd(request.getPeriodEnd())
                    .build();
            case SCHEDULED_REPORT -> ScheduledReportJobPayload.builder()
                    .reportId(scheduledReportService.getScheduledReport(tenantId, request.getReportId()).getId())
                    .tenantId(tenantId)
                    .build();
            case CACHE_WARM -> CacheWarmJobPayload.builder().tenantId(tenantId).build();
        };

        UUID jobId = jobProcessor.submitJob(request.getType(), payload);
        return ResponseEntity.accepted().body(Map.of("jobId", jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AnalyticsJobEntity> getJobStatus(@PathVariable UUID jobId) {
        log.info("Get job status: jobId={}", jobId);
        return ResponseEntity.ok(jobProcessor.getJobStatus(jobId));
    }

    private LocalDate orToday(LocalDate date) {
        return date != null ? date : LocalDate.now(clock);
    }
}
