package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One run attempt of a scheduled report.
 *
 * Lifecycle: PENDING, then PROCESSING, then SENT or FAILED.
 */
@Entity
@Table(name = "report_deliveries", indexes = {
    @Index(name = "idx_delivery_report_created", columnList = "reportId, createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDeliveryEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID reportId;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ScheduledReportEntity.ReportFormat format;

    /**
     * Comma-separated addresses the delivery was sent to.
     */
    @Column(columnDefinition = "TEXT")
    private String recipients;

    private Instant deliveredAt;

    @Column(length = 1000)
    private String errorMessage;

    private Long fileSize;

    @Column(nullable = false)
    private Instant createdAt;

    public enum DeliveryStatus {
        PENDING,
        PROCESSING,
        SENT,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markProcessing() {
        this.status = DeliveryStatus.PROCESSING;
    }

    public void markSent(long fileSize, Instant deliveredAt) {
        this.status = DeliveryStatus.SENT;
        this.fileSize = fileSize;
        this.deliveredAt = deliveredAt;
        this.errorMessage = null;
    }

    public void markFailed(String error) {
        this.status = DeliveryStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
