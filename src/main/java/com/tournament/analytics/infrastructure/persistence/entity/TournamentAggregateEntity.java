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

@Entity
@Table(name = "tournament_aggregates",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_tournament_aggregate_period",
                columnNames = {"tenantId", "periodType", "periodStart"}),
        indexes = @Index(name = "idx_tournament_tenant_period_start", columnList = "tenantId, periodStart"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentAggregateEntity {

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

    private int tournamentCount;

    private int completedCount;

    @Column(precision = 5, scale = 2)
    private BigDecimal completionRate;

    private int totalPlayers;

    @Column(precision = 10, scale = 2)
    private BigDecimal avgPlayers;

    @Column(precision = 10, scale = 2)
    private BigDecimal avgDurationMinutes;

    @Column(length = 100)
    private String mostPopularFormat;

    @Column(precision = 12, scale = 2)
    private BigDecimal revenue;

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
