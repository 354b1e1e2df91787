package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Report configuration. Deleting a report sets {@link #deletedAt}; delivery history is kept.
 */
@Entity
@Table(name = "scheduled_reports", indexes = {
    @Index(name = "idx_report_tenant", columnList = "tenantId"),
    @Index(name = "idx_report_next_run", columnList = "nextRunAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledReportEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Column(length = 1000)
    private String description;

    @Builder.Default
    private boolean enabled = true;

    @Embedded
    private ReportSchedule schedule;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scheduled_report_recipients", joinColumns = @JoinColumn(name = "report_id"))
    @Builder.Default
    private List<ReportRecipient> recipients = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private ReportFormat format = ReportFormat.CSV;

    @Embedded
    @Builder.Default
    private ReportSections sections = new ReportSections();

    @Embedded
    @Builder.Default
    private ReportDateRange dateRange = new ReportDateRange();

    private Instant lastRunAt;

    private Instant nextRunAt;

    @Column(nullable = false, length = 64)
    private String createdBy;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    private Instant deletedAt;

    public enum ReportFormat {
        CSV,
        JSON,
        EXCEL,
        PDF
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
