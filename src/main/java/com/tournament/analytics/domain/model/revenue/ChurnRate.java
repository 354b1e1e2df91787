package com.tournament.analytics.domain.model.revenue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Revenue churn of a month against a reference month.
 *
 * Rates are null while churned revenue is not tracked for either month.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChurnRate {

    private LocalDate periodStart;
    private LocalDate periodEnd;
    private Double rate;
    private BigDecimal churnedRevenue;
    private BigDecimal totalRevenue;
    private Double previousRate;
    private BigDecimal previousChurnedRevenue;
    private Trend trend;

    public enum Trend {
        INCREASING,
        DECREASING,
        STABLE,
        UNAVAILABLE
    }
}
