package com.tournament.analytics.domain.model.revenue;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Compounding projection of monthly revenue at the historical average growth rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueProjection {

    private List<ProjectedMonth> projections;
    private int historicalMonths;
    private double avgGrowthRate;
    private Confidence confidence;

    @Builder.Default
    private String method = "compound_growth";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectedMonth {
        private LocalDate month;
        private BigDecimal projectedRevenue;
        private BigDecimal low;
        private BigDecimal high;
    }
}
