package com.tournament.analytics.job;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.service.report.ScheduledReportService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.job.payload.AggregationJobPayload;
import com.tournament.analytics.job.payload.ScheduledReportJobPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Enqueues recurring work. Every job carries a dedupe key, so a tick that fires while the
 * previous job for the same period or report is still queued adds nothing.
 *
 * Schedules (app.scheduler.*):
 * - hourly: today's day aggregates
 * - daily: yesterday's day aggregates, closing the previous day
 * - weekly: last week's aggregates
 * - monthly: last month's aggregates, including that month's signup cohort
 * - report check: one job per due scheduled report
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsScheduler {

    private final AnalyticsJobProcessor jobProcessor;
    private final ScheduledReportService scheduledReportService;
    private final Clock clock;

    @Scheduled(cron = "${app.scheduler.hourly-aggregation-cron:0 0 * * * *}")
    public void scheduleHourlyAggregation() {
        enqueueAggregation(PeriodType.DAY, LocalDate.now(clock));
    }

    @Scheduled(cron = "${app.scheduler.daily-aggregation-cron:0 0 0 * * *}")
    public void scheduleDailyAggregation() {
        enqueueAggregation(PeriodType.DAY, LocalDate.now(clock).minusDays(1));
    }

    @Scheduled(cron = "${app.scheduler.weekly-aggregation-cron:0 0 2 * * MON}")
    public void scheduleWeeklyAggregation() {
        enqueueAggregation(PeriodType.WEEK, LocalDate.now(clock).minusWeeks(1));
    }

    @Scheduled(cron = "${app.scheduler.monthly-aggregation-cron:0 0 1 1 * *}")
    public void scheduleMonthlyAggregation() {
        enqueueAggregation(PeriodType.MONTH, LocalDate.now(clock).minusMonths(1));
    }

    @Scheduled(cron = "${app.scheduler.report-check-cron:0 5 * * * *}")
    public void scheduleDueReports() {
        List<ScheduledReportEntity> dueReports = scheduledReportService.getReportsDueToRun();
        if (dueReports.isEmpty()) {
            return;
        }

        int queued = 0;
        for (ScheduledReportEntity report : dueReports) {
            ScheduledReportJobPayload payload = ScheduledReportJobPayload.builder()
                    .reportId(report.getId())
                    .tenantId(report.getTenantId())
                    .build();
            String dedupeKey = "report:" + report.getId() + ":" + report.getNextRunAt();
            if (jobProcessor.enqueue(JobType.SCHEDULED_REPORT, payload, dedupeKey).isPresent()) {
                queued++;
            }
        }
        log.info("Queued {} of {} due scheduled reports", queued, dueReports.size());
    }

    /**
     * Enqueues an all-tenant aggregation of the period containing {@code date}.
     */
    public void enqueueAggregation(PeriodType periodType, LocalDate date) {
        LocalDate start = periodType.startOf(date);
        AggregationJobPayload payload = AggregationJobPayload.builder()
                .periodType(periodType)
                .periodStart(start)
                .periodEnd(periodType.endOf(start))
                .build();
        String dedupeKey = "aggregation:all:" + periodType + ":" + start;

        jobProcessor.enqueue(JobType.AGGREGATION, payload, dedupeKey)
                .ifPresent(jobId -> log.info("Queued {} aggregation for {} (job {})", periodType, start, jobId));
    }
}
