package com.tournament.analytics.domain.model.dashboard;

import com.tournament.analytics.domain.model.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Headline KPIs for a tenant. Revenue figures are always present; cohort and tournament
 * figures are null when that part of the analysis is unavailable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {

    private String tenantId;
    private LocalDate periodStart;
    private LocalDate periodEnd;

    private BigDecimal mrr;
    private BigDecimal arr;
    private BigDecimal totalRevenue;
    private Double mrrGrowth;

    private Integer activeUsers;
    private Double retentionRate;
    private Double churnRate;
    private BigDecimal avgLtv;

    private Integer totalTournaments;
    private Double completionRate;

    private TrendDirection revenueTrend;
    private TrendDirection retentionTrend;
    private TrendDirection tournamentTrend;

    private List<Alert> alerts;

    private boolean cached;
    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Alert {
        private AlertType type;
        private String message;
    }

    public enum AlertType {
        WARNING,
        INFO,
        SUCCESS
    }
}
