package com.tournament.analytics.job;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.service.report.ScheduledReportService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.job.payload.AggregationJobPayload;
import com.tournament.analytics.job.payload.ScheduledReportJobPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsSchedulerTest {

    @Mock
    private AnalyticsJobProcessor jobProcessor;

    @Mock
    private ScheduledReportService scheduledReportService;

    private AnalyticsScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AnalyticsScheduler(jobProcessor, scheduledReportService,
                Clock.fixed(Instant.parse("2024-06-01T01:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testScheduleMonthlyAggregation_CoversPreviousMonth() {
        // Given
        when(jobProcessor.enqueue(eq(JobType.AGGREGATION), any(), anyString()))
                .thenReturn(Optional.of(UUID.randomUUID()));

        // When
        scheduler.scheduleMonthlyAggregation();

        // Then
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(jobProcessor).enqueue(eq(JobType.AGGREGATION), payload.capture(),
                eq("aggregation:all:MONTH:2024-05-01"));
        AggregationJobPayload aggregation = (AggregationJobPayload) payload.getValue();
        assertNull(aggregation.getTenantId());
        assertEquals(PeriodType.MONTH, aggregation.getPeriodType());
        assertEquals(LocalDate.of(2024, 5, 31), aggregation.getPeriodEnd());
    }

    @Test
    void testScheduleDailyAggregation_ClosesYesterday() {
        // Given
        when(jobProcessor.enqueue(eq(JobType.AGGREGATION), any(), anyString())).thenReturn(Optional.empty());

        // When
        scheduler.scheduleDailyAggregation();

        // Then
        verify(jobProcessor).enqueue(eq(JobType.AGGREGATION), any(), eq("aggregation:all:DAY:2024-05-31"));
    }

    @Test
    void testScheduleDueReports_OneJobPerReportOccurrence() {
        // Given
        UUID reportId = UUID.randomUUID();
        Instant nextRun = Instant.parse("2024-06-01T00:00:00Z");
        when(scheduledReportService.getReportsDueToRun()).thenReturn(List.of(ScheduledReportEntity.builder()
                .id(reportId)
                .tenantId("tenant-1")
                .nextRunAt(nextRun)
                .build()));
        when(jobProcessor.enqueue(eq(JobType.SCHEDULED_REPORT), any(), anyString()))
                .thenReturn(Optional.of(UUID.randomUUID()));

        // When
        scheduler.scheduleDueReports();

        // Then
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(jobProcessor).enqueue(eq(JobType.SCHEDULED_REPORT), payload.capture(),
                eq("report:" + reportId + ":" + nextRun));
        assertEquals(reportId, ((ScheduledReportJobPayload) payload.getValue()).getReportId());
    }

    @Test
    void testScheduleDueReports_NothingDue() {
        // Given
        when(scheduledReportService.getReportsDueToRun()).thenReturn(Collections.emptyList());

        // When
        scheduler.scheduleDueReports();

        // Then
        verifyNoInteractions(jobProcessor);
    }
}
