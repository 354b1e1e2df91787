package com.tournament.analytics.domain.service.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.exception.ReportDeliveryException;
import com.tournament.analytics.domain.model.report.ReportAttachment;
import com.tournament.analytics.domain.model.report.ReportRunResult;
import com.tournament.analytics.domain.service.AnalyticsOrchestrator;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDateRange;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity.DeliveryStatus;
import com.tournament.analytics.infrastructure.persistence.entity.ReportRecipient;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSchedule;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity.ReportFormat;
import com.tournament.analytics.infrastructure.persistence.repository.ReportDeliveryRepository;
import com.tournament.analytics.infrastructure.persistence.repository.ScheduledReportRepository;
import com.tournament.analytics.infrastructure.report.JsonReportRenderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ScheduledReportWorkflow.
 */
@ExtendWith(MockitoExtension.class)
class ScheduledReportWorkflowTest {

    private static final String TENANT = "tenant-1";
    private static final Instant NOW = Instant.parse("2024-05-15T08:00:00Z");

    @Mock
    private ScheduledReportRepository scheduledReportRepository;

    @Mock
    private ReportDeliveryRepository reportDeliveryRepository;

    @Mock
    private ScheduledReportService scheduledReportService;

    @Mock
    private AnalyticsOrchestrator orchestrator;

    @Mock
    private ReportDeliveryChannel deliveryChannel;

    private SimpleMeterRegistry meterRegistry;
    private ScheduledReportWorkflow workflow;
    private UUID reportId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        workflow = new ScheduledReportWorkflow(scheduledReportRepository, reportDeliveryRepository,
                scheduledReportService, new ReportDateRangeResolver(clock), orchestrator, deliveryChannel,
                List.of(new JsonReportRenderer(new ObjectMapper().findAndRegisterModules())),
                clock, meterRegistry);
        reportId = UUID.randomUUID();
    }

    @Test
    void testRun_DeliversAndReschedules() {
        // Given
        ScheduledReportEntity report = report(ReportFormat.JSON);
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.of(report));
        stubDeliverySave();
        when(orchestrator.getDashboardSummary(TENANT)).thenThrow(new NotFoundException("No revenue data"));
        when(deliveryChannel.deliver(anyList(), anyString(), any(ReportAttachment.class)))
                .thenReturn(NOW.plusSeconds(5));
        Instant nextRun = Instant.parse("2024-05-20T09:00:00Z");
        when(scheduledReportService.updateReportLastRun(reportId))
                .thenReturn(ScheduledReportEntity.builder().id(reportId).nextRunAt(nextRun).build());

        List<Integer> progress = new ArrayList<>();

        // When
        ReportRunResult result = workflow.run(reportId, progress::add);

        // Then
        assertEquals(DeliveryStatus.SENT, result.getStatus());
        assertEquals(List.of("ops@example.com", "cfo@example.com"), result.getRecipients());
        assertEquals(List.of("summary"), result.getSkippedSections());
        assertEquals(nextRun, result.getNextRunAt());
        assertEquals(List.of(0, 10, 50, 80, 90, 100), progress);

        ArgumentCaptor<ReportAttachment> attachment = ArgumentCaptor.forClass(ReportAttachment.class);
        verify(deliveryChannel).deliver(anyList(), eq("Weekly Ops! (2024-05-08 to 2024-05-14)"), attachment.capture());
        assertEquals("weekly-ops-20240508-20240514.json", attachment.getValue().getFilename());
        assertEquals("application/json", attachment.getValue().getContentType());
        assertTrue(attachment.getValue().size() > 0);
        assertEquals(attachment.getValue().size(), result.getFileSize());

        ReportDeliveryEntity delivery = lastSavedDelivery();
        assertEquals(DeliveryStatus.SENT, delivery.getStatus());
        assertEquals("ops@example.com,cfo@example.com", delivery.getRecipients());
        assertEquals(1.0, meterRegistry.counter("analytics.reports", "status", "sent").count());
    }

    @Test
    void testRun_DeliveryFailureRecordedAndRethrown() {
        // Given
        ScheduledReportEntity report = report(ReportFormat.JSON);
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.of(report));
        stubDeliverySave();
        when(deliveryChannel.deliver(anyList(), anyString(), any(ReportAttachment.class)))
                .thenThrow(new ReportDeliveryException("Mail relay unavailable"));

        // When / Then
        ReportDeliveryException ex = assertThrows(ReportDeliveryException.class,
                () -> workflow.run(reportId, percent -> { }));
        assertEquals("Mail relay unavailable", ex.getMessage());

        ReportDeliveryEntity delivery = lastSavedDelivery();
        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertEquals("Mail relay unavailable", delivery.getErrorMessage());
        verify(scheduledReportService, never()).updateReportLastRun(any());
        assertEquals(1.0, meterRegistry.counter("analytics.reports", "status", "failed").count());
    }

    @Test
    void testRun_RescheduleFailureAfterSendKeepsSentResult() {
        // Given
        ScheduledReportEntity report = report(ReportFormat.JSON);
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.of(report));
        stubDeliverySave();
        when(orchestrator.getDashboardSummary(TENANT)).thenThrow(new NotFoundException("No revenue data"));
        when(deliveryChannel.deliver(anyList(), anyString(), any(ReportAttachment.class)))
                .thenReturn(NOW.plusSeconds(5));
        when(scheduledReportService.updateReportLastRun(reportId))
                .thenThrow(new IllegalStateException("deadlock detected"));

        // When
        ReportRunResult result = workflow.run(reportId, percent -> { });

        // Then
        assertEquals(DeliveryStatus.SENT, result.getStatus());
        assertNull(result.getNextRunAt());
        verify(scheduledReportService).skipToNextRun(reportId);
        verify(deliveryChannel, times(1)).deliver(anyList(), anyString(), any(ReportAttachment.class));
        assertEquals(DeliveryStatus.SENT, lastSavedDelivery().getStatus());
        assertEquals(1.0, meterRegistry.counter("analytics.reports", "status", "sent").count());
        assertEquals(0.0, meterRegistry.counter("analytics.reports", "status", "failed").count());
    }

    @Test
    void testRun_UnsupportedFormatFails() {
        // Given
        ScheduledReportEntity report = report(ReportFormat.PDF);
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.of(report));
        stubDeliverySave();

        // When / Then
        assertThrows(ReportDeliveryException.class, () -> workflow.run(reportId, percent -> { }));

        ReportDeliveryEntity delivery = lastSavedDelivery();
        assertEquals(DeliveryStatus.FAILED, delivery.getStatus());
        assertTrue(delivery.getErrorMessage().contains("PDF"));
        verifyNoInteractions(deliveryChannel);
    }

    @Test
    void testRun_DisabledReportIsSkipped() {
        // Given
        ScheduledReportEntity report = report(ReportFormat.JSON);
        report.setEnabled(false);
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.of(report));

        // When
        ReportRunResult result = workflow.run(reportId, percent -> { });

        // Then
        assertTrue(result.isSkipped());
        verifyNoInteractions(reportDeliveryRepository, orchestrator, deliveryChannel);
    }

    @Test
    void testRun_MissingReport() {
        // Given
        when(scheduledReportRepository.findById(reportId)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(NotFoundException.class, () -> workflow.run(reportId, percent -> { }));
    }

    private ScheduledReportEntity report(ReportFormat format) {
        return ScheduledReportEntity.builder()
                .id(reportId)
                .tenantId(TENANT)
                .name("Weekly Ops!")
                .schedule(ReportSchedule.builder().frequency(ReportSchedule.Frequency.WEEKLY).build())
                .recipients(List.of(
                        ReportRecipient.builder().email("ops@example.com").build(),
                        ReportRecipient.builder().email("cfo@example.com").type(ReportRecipient.RecipientType.CC).build()))
                .format(format)
                .dateRange(ReportDateRange.builder().rangeType(ReportDateRange.RangeType.LAST_7_DAYS).build())
                .createdBy("user-1")
                .createdAt(NOW)
                .build();
    }

    private void stubDeliverySave() {
        when(reportDeliveryRepository.save(any(ReportDeliveryEntity.class))).thenAnswer(inv -> {
            ReportDeliveryEntity delivery = inv.getArgument(0);
            if (delivery.getId() == null) {
                delivery.setId(UUID.randomUUID());
            }
            return delivery;
        });
    }

    private ReportDeliveryEntity lastSavedDelivery() {
        ArgumentCaptor<ReportDeliveryEntity> saved = ArgumentCaptor.forClass(ReportDeliveryEntity.class);
        verify(reportDeliveryRepository, atLeastOnce()).save(saved.capture());
        List<ReportDeliveryEntity> all = saved.getAllValues();
        return all.get(all.size() - 1);
    }
}
