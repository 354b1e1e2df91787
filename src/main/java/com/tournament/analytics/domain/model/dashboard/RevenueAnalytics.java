package com.tournament.analytics.domain.model.dashboard;

import com.tournament.analytics.domain.model.revenue.MrrMetrics;
import com.tournament.analytics.domain.model.revenue.RevenueBreakdown;
import com.tournament.analytics.domain.model.revenue.RevenueProjection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Revenue view of one month. Previous-month fields and the projection are absent when
 * there is nothing to compare with or not enough history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueAnalytics {

    private String tenantId;
    private MrrMetrics current;
    private BigDecimal totalRevenue;
    private BigDecimal previousTotalRevenue;
    private Double mrrGrowth;
    private Double revenueGrowth;
    private RevenueBreakdown breakdown;
    private RevenueProjection projection;

    private boolean cached;
    private Instant generatedAt;
}
