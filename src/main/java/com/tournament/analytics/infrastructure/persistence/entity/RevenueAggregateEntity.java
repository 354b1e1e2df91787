package com.tournament.analytics.infrastructure.persistence.entity;

import com.tournament.analytics.domain.model.PeriodType;
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
 * Revenue summary for one tenant and period. Unique per (tenant, period type, period start).
 *
 * newRevenue, churnedRevenue and expansionRevenue stay null: subscription-level revenue
 * movement is not tracked, and null means "not computed", not zero.
 */
@Entity
@Table(name = "revenue_aggregates",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_revenue_aggregate_period",
                columnNames = {"tenantId", "periodType", "periodStart"}),
        indexes = @Index(name = "idx_revenue_tenant_period_start", columnList = "tenantId, periodStart"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueAggregateEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PeriodType periodType;

    @Column(nullable = false)
    private LocalDate periodStart;

    @Column(nullable = false)
    private LocalDate periodEnd;

    @Column(precision = 12, scale = 2)
    private BigDecimal mrr;

    @Column(precision = 12, scale = 2)
    private BigDecimal arr;

    @Column(precision = 12, scale = 2)
    private BigDecimal newRevenue;

    @Column(precision = 12, scale = 2)
    private BigDecimal churnedRevenue;

    @Column(precision = 12, scale = 2)
    private BigDecimal expansionRevenue;

    @Column(precision = 12, scale = 2)
    private BigDecimal totalRevenue;

    private int paymentCount;

    private int paymentSuccessCount;

    private int refundCount;

    @Column(precision = 12, scale = 2)
    private BigDecimal refundAmount;

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
