package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.report.ScheduledReportRequest;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDateRange;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity;
import com.tournament.analytics.infrastructure.persistence.entity.ReportRecipient;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSections;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.infrastructure.persistence.repository.ReportDeliveryRepository;
import com.tournament.analytics.infrastructure.persistence.repository.ScheduledReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scheduled report configuration and delivery history.
 *
 * Reports are tenant-scoped: lookups with a tenant other than the owner's behave as if
 * the report did not exist. Deleting is soft, so the delivery history stays queryable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduledReportService {

    private final ScheduledReportRepository scheduledReportRepository;
    private final ReportDeliveryRepository reportDeliveryRepository;
    private final ReportScheduleCalculator scheduleCalculator;
    private final ReportDateRangeResolver dateRangeResolver;
    private final Clock clock;

    @Value("${app.reports.history-limit:50}")
    private int historyLimit;

    @Transactional
    public ScheduledReportEntity createScheduledReport(String tenantId, String userId, ScheduledReportRequest request) {
        scheduleCalculator.validate(request.getSchedule());
        ReportDateRange dateRange = request.getDateRange() != null ? request.getDateRange() : new ReportDateRange();
        dateRangeResolver.resolve(dateRange);

        Instant now = clock.instant();
        ScheduledReportEntity report = ScheduledReportEntity.builder()
                .tenantId(tenantId)
                .name(request.getName())
                .description(request.getDescription())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .schedule(request.getSchedule())
                .recipients(recipients(request))
                .format(request.getFormat() != null ? request.getFormat() : ScheduledReportEntity.ReportFormat.CSV)
                .sections(request.getSections() != null ? request.getSections() : new ReportSections())
                .dateRange(dateRange)
                .nextRunAt(scheduleCalculator.nextRunAfter(request.getSchedule(), now))
                .createdBy(userId)
                .createdAt(now)
                .build();

        report = scheduledReportRepository.save(report);
        log.info("Scheduled report created: {} for tenant {} (next run {})",
                report.getId(), tenantId, report.getNextRunAt());
        return report;
    }

    /**
     * Applies the non-null fields of the request. A changed schedule recomputes the next run.
     */
    @Transactional
    public ScheduledReportEntity updateScheduledReport(String tenantId, UUID reportId, ScheduledReportRequest request) {
        ScheduledReportEntity report = getScheduledReport(tenantId, reportId);

        if (request.getName() != null) {
            report.setName(request.getName());
        }
        if (request.getDescription() != null) {
            report.setDescription(request.getDescription());
        }
        if (request.getEnabled() != null) {
            report.setEnabled(request.getEnabled());
        }
        if (request.getRecipients() != null && !request.getRecipients().isEmpty()) {
            report.setRecipients(recipients(request));
        }
        if (request.getFormat() != null) {
            report.setFormat(request.getFormat());
        }
        if (request.getSections() != null) {
            report.setSections(request.getSections());
        }
        if (request.getDateRange() != null) {
            dateRangeResolver.resolve(request.getDateRange());
            report.setDateRange(request.getDateRange());
        }
        if (request.getSchedule() != null) {
            scheduleCalculator.validate(request.getSchedule());
            report.setSchedule(request.getSchedule());
            report.setNextRunAt(scheduleCalculator.nextRunAt(request.getSchedule()));
        }

        log.info("Scheduled report updated: {}", reportId);
        return scheduledReportRepository.save(report);
    }

    @Transactional
    public void deleteScheduledReport(String tenantId, UUID reportId) {
        ScheduledReportEntity report = getScheduledReport(tenantId, reportId);
        report.setDeletedAt(clock.instant());
        report.setEnabled(false);
        scheduledReportRepository.save(report);
        log.info("Scheduled report deleted: {}", reportId);
    }

    @Transactional(readOnly = true)
    public List<ScheduledReportEntity> getScheduledReports(String tenantId) {
        return scheduledReportRepository.findByTenantIdAndDeletedAtIsNullOrderByCreatedAtDesc(tenantId);
    }

    @Transactional(readOnly = true)
    public ScheduledReportEntity getScheduledReport(String tenantId, UUID reportId) {
        return scheduledReportRepository.findByIdAndDeletedAtIsNull(reportId)
                .filter(report -> report.getTenantId().equals(tenantId))
                .orElseThrow(() -> new NotFoundException("Scheduled report not found: " + reportId));
    }

    @Transactional(readOnly = true)
    public List<ReportDeliveryEntity> getReportHistory(String tenantId, UUID reportId, Integer limit) {
        getScheduledReportIncludingDeleted(tenantId, reportId);
        int size = limit == null || limit <= 0 ? historyLimit : Math.min(limit, historyLimit);
        return reportDeliveryRepository.findByReportIdOrderByCreatedAtDesc(reportId, PageRequest.of(0, size));
    }

    /**
     * Enabled, non-deleted reports whose next run is unset or not after now.
     */
    @Transactional(readOnly = true)
    public List<ScheduledReportEntity> getReportsDueToRun() {
        return scheduledReportRepository.findDue(clock.instant());
    }

    /**
     * Records a run and moves the report to the first occurrence after now.
     */
    @Transactional
    public ScheduledReportEntity updateReportLastRun(UUID reportId) {
        ScheduledReportEntity report = scheduledReportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("Scheduled report not found: " + reportId));
        Instant now = clock.instant();
        report.setLastRunAt(now);
        report.setNextRunAt(scheduleCalculator.nextRunAfter(report.getSchedule(), now));
        return scheduledReportRepository.save(report);
    }

    /**
     * Moves the report to its next occurrence without recording a run.
     */
    @Transactional
    public void skipToNextRun(UUID reportId) {
        scheduledReportRepository.findById(reportId).ifPresent(report -> {
            report.setNextRunAt(scheduleCalculator.nextRunAt(report.getSchedule()));
            scheduledReportRepository.save(report);
            log.warn("Scheduled report {} skipped to next run at {}", reportId, report.getNextRunAt());
        });
    }

    private ScheduledReportEntity getScheduledReportIncludingDeleted(String tenantId, UUID reportId) {
        return scheduledReportRepository.findById(reportId)
                .filter(report -> report.getTenantId().equals(tenantId))
                .orElseThrow(() -> new NotFoundException("Scheduled report not found: " + reportId));
    }

    private static List<ReportRecipient> recipients(ScheduledReportRequest request) {
        List<ReportRecipient> recipients = new ArrayList<>();
        for (ScheduledReportRequest.Recipient recipient : request.getRecipients()) {
            recipients.add(recipient.toEmbeddable());
        }
        return recipients;
    }
}
