package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Retention of one signup cohort in one month since signup.
 * Unique per (tenant, cohort month, month number).
 */
@Entity
@Table(name = "user_cohorts",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_user_cohort_month",
                columnNames = {"tenantId", "cohortMonth", "monthNumber"}),
        indexes = @Index(name = "idx_cohort_tenant_month", columnList = "tenantId, cohortMonth"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCohortEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    /**
     * First day of the signup month.
     */
    @Column(nullable = false)
    private LocalDate cohortMonth;

    @Column(nullable = false)
    private int monthNumber;

    @Column(nullable = false)
    private int cohortSize;

    @Column(nullable = false)
    private int retainedUsers;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal retentionRate;

    @Column(precision = 12, scale = 2)
    private BigDecimal revenue;

    /**
     * Cumulative revenue per cohort member up to and including this month.
     */
    @Column(precision = 12, scale = 2)
    private BigDecimal lifetimeValue;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
