package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.exception.AnalyticsException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.aggregation.PeriodBoundary;
import com.tournament.analytics.domain.model.report.ReportAttachment;
import com.tournament.analytics.domain.model.report.ReportData;
import com.tournament.analytics.domain.model.report.ReportRunResult;
import com.tournament.analytics.domain.model.tournament.AnalysisOptions;
import com.tournament.analytics.domain.service.AnalyticsOrchestrator;
import com.tournament.analytics.domain.service.ProgressListener;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity;
import com.tournament.analytics.infrastructure.persistence.entity.ReportRecipient;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSections;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.infrastructure.persistence.repository.ReportDeliveryRepository;
import com.tournament.analytics.infrastructure.persistence.repository.ScheduledReportRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs one scheduled report: gather the enabled sections, render, deliver, reschedule.
 *
 * A delivery record is written before anything can fail, so every run leaves an audit
 * entry ending in SENT or FAILED. Progress markers: 0 start, 10 date range resolved,
 * 50 analytics gathered, 80 rendered, 90 delivered, 100 rescheduled.
 */
@Slf4j
@Service
public class ScheduledReportWorkflow {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final ScheduledReportRepository scheduledReportRepository;
    private final ReportDeliveryRepository reportDeliveryRepository;
    private final ScheduledReportService scheduledReportService;
    private final ReportDateRangeResolver dateRangeResolver;
    private final AnalyticsOrchestrator orchestrator;
    private final ReportDeliveryChannel deliveryChannel;
    private final Map<ScheduledReportEntity.ReportFormat, ReportRenderer> renderers;
    private final Clock clock;

    private final Counter sentCounter;
    private final Counter failedCounter;

    public ScheduledReportWorkflow(ScheduledReportRepository scheduledReportRepository,
                                   ReportDeliveryRepository reportDeliveryRepository,
                                   ScheduledReportService scheduledReportService,
                                   ReportDateRangeResolver dateRangeResolver,
                                   AnalyticsOrchestrator orchestrator,
                                   ReportDeliveryChannel deliveryChannel,
                                   List<ReportRenderer> renderers,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.scheduledReportRepository = scheduledReportRepository;
        this.reportDeliveryRepository = reportDeliveryRepository;
        this.scheduledReportService = scheduledReportService;
        this.dateRangeResolver = dateRangeResolver;
        this.orchestrator = orchestrator;
        this.deliveryChannel = deliveryChannel;
        this.clock = clock;

        this.renderers = new EnumMap<>(ScheduledReportEntity.ReportFormat.class);
        for (ReportRenderer renderer : renderers) {
            this.renderers.put(renderer.format(), renderer);
        }

        this.sentCounter = Counter.builder("analytics.reports")
                .tag("status", "sent")
                .description("Scheduled report deliveries")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("analytics.reports")
                .tag("status", "failed")
                .description("Scheduled report deliveries")
                .register(meterRegistry);
    }

    /**
     * Only failures before the delivery channel accepts the report fail the run. Once sent,
     * bookkeeping errors are logged and the SENT result is returned.
     *
     * @throws ReportDeliveryException when the run failed; the FAILED delivery record has
     *         already been saved
     */
    public ReportRunResult run(UUID reportId, ProgressListener progress) {
        progress.onProgress(0);

        ScheduledReportEntity report = scheduledReportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Scheduled report not found: " + reportId));
        if (!report.isEnabled() || report.isDeleted()) {
            log.info("Scheduled report {} is disabled, skipping", reportId);
            progress.onProgress(100);
            return ReportRunResult.builder().reportId(reportId).skipped(true).build();
        }

        List<String> recipients = recipientAddresses(report);
        ReportDeliveryEntity delivery = reportDeliveryRepository.save(ReportDeliveryEntity.builder()
                .reportId(reportId)
                .tenantId(report.getTenantId())
                .format(report.getFormat())
                .recipients(String.join(",", recipients))
                .createdAt(clock.instant())
                .build());

        ReportData data;
        ReportAttachment attachment;
        Instant deliveredAt;
        try {
            PeriodBoundary range = dateRangeResolver.resolve(report.getDateRange());
            progress.onProgress(10);

            data = gather(report, range);
            progress.onProgress(50);

            ReportRenderer renderer = renderers.get(report.getFormat());
            if (renderer == null) {
                throw new ReportDeliveryException("Report format " + report.getFormat() + " is not supported");
            }
            attachment = ReportAttachment.builder()
                    .filename(filename(report, range, renderer))
                    .contentType(renderer.contentType())
                    .content(renderer.render(data))
                    .build();
            progress.onProgress(80);

            delivery.markProcessing();
            delivery = reportDeliveryRepository.save(delivery);
            deliveredAt = deliveryChannel.deliver(recipients, subject(report, range), attachment);
        } catch (RuntimeException e) {
            log.error("Scheduled report {} failed: {}", reportId, e.getMessage(), e);
            delivery.markFailed(e.getMessage());
            reportDeliveryRepository.save(delivery);
            failedCounter.increment();
            if (e instanceof ReportDeliveryException) {
                throw e;
            }
            throw new ReportDeliveryException("Scheduled report " + reportId + " failed: " + e.getMessage(), e);
        }

        // Delivered. Nothing below may fail the run or the report is sent twice.
        delivery.markSent(attachment.size(), deliveredAt);
        delivery = saveSentDelivery(reportId, delivery);
        sentCounter.increment();
        progress.onProgress(90);

        Instant nextRunAt = reschedule(reportId);
        progress.onProgress(100);

        log.info("Scheduled report {} delivered to {} recipients ({} bytes)",
                reportId, recipients.size(), attachment.size());

        return ReportRunResult.builder()
                .reportId(reportId)
                .deliveryId(delivery.getId())
                .status(delivery.getStatus())
                .recipients(recipients)
                .fileSize(attachment.size())
                .skippedSections(data.getSkippedSections())
                .nextRunAt(nextRunAt)
                .build();
    }

    private ReportDeliveryEntity saveSentDelivery(UUID reportId, ReportDeliveryEntity delivery) {
        try {
            return reportDeliveryRepository.save(delivery);
        } catch (RuntimeException e) {
            log.error("Scheduled report {} was delivered but delivery {} could not be marked SENT",
                    reportId, delivery.getId(), e);
            return delivery;
        }
    }

    /**
     * Records the run and returns the next occurrence. When the run cannot be recorded the
     * report is moved past the current occurrence instead, and null is returned.
     */
    private Instant reschedule(UUID reportId) {
        try {
            return scheduledReportService.updateReportLastRun(reportId).getNextRunAt();
        } catch (RuntimeException e) {
            log.warn("Scheduled report {} was delivered but its run could not be recorded: {}",
                    reportId, e.getMessage());
        }
        try {
            scheduledReportService.skipToNextRun(reportId);
        } catch (RuntimeException e) {
            log.error("Scheduled report {} could not be moved to its next run", reportId, e);
        }
        return null;
    }

    ReportData gather(ScheduledReportEntity report, PeriodBoundary range) {
        String tenantId = report.getTenantId();
        ReportSections sections = report.getSections() != null ? report.getSections() : new ReportSections();
        ReportData data = ReportData.builder()
                .tenantId(tenantId)
                .reportName(report.getName())
                .periodStart(range.getStart())
                .periodEnd(range.getEnd())
                .generatedAt(clock.instant())
                .build();

        if (sections.isSummary()) {
            data.setSummary(section(data, "summary", () -> orchestrator.getDashboardSummary(tenantId)));
        }
        if (sections.isRevenue()) {
            data.setRevenue(section(data, "revenue",
                    () -> orchestrator.getRevenueAnalytics(tenantId, range.getEnd())));
        }
        if (sections.isUsers()) {
            data.setUsers(section(data, "users",
                    () -> orchestrator.getPlayerEngagement(tenantId, range.getStart(), range.getEnd())));
        }
        if (sections.isCohorts()) {
            data.setCohorts(section(data, "cohorts", () -> orchestrator.getCohortAnalytics(tenantId)));
        }
        if (sections.isTournaments()) {
            AnalysisOptions options = AnalysisOptions.builder()
                    .startDate(range.getStart())
                    .endDate(range.getEnd())
                    .periodType(PeriodType.DAY)
                    .includeFormatBreakdown(true)
                    .build();
            data.setTournaments(section(data, "tournaments",
                    () -> orchestrator.getTournamentPerformance(tenantId, options)));
        }
        if (sections.isPredictions()) {
            data.setPredictions(section(data, "predictions", () -> orchestrator.getRevenueForecast(tenantId, 3)));
        }
        return data;
    }

    private static <T> T section(ReportData data, String name, Supplier<T> loader) {
        try {
            return loader.get();
        } catch (AnalyticsException e) {
            log.warn("Report section {} unavailable for tenant {}: {}", name, data.getTenantId(), e.getMessage());
            data.getSkippedSections().add(name);
            return null;
        }
    }

    private static List<String> recipientAddresses(ScheduledReportEntity report) {
        List<String> addresses = new ArrayList<>();
        for (ReportRecipient recipient : report.getRecipients()) {
            addresses.add(recipient.getEmail());
        }
        return addresses;
    }

    private static String filename(ScheduledReportEntity report, PeriodBoundary range, ReportRenderer renderer) {
        String slug = report.getName().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug + "-" + FILE_DATE.format(range.getStart()) + "-" + FILE_DATE.format(range.getEnd())
                + "." + renderer.fileExtension();
    }

    private static String subject(ScheduledReportEntity report, PeriodBoundary range) {
        return report.getName() + " (" + range.getStart() + " to " + range.getEnd() + ")";
    }
}
