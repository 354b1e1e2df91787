package com.tournament.analytics.domain.model.revenue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Composition of one month's revenue. New, expansion and churned revenue are null
 * while those movements are not tracked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueBreakdown {

    private LocalDate periodStart;
    private LocalDate periodEnd;
    private BigDecimal total;
    private BigDecimal newRevenue;
    private BigDecimal existingRevenue;
    private BigDecimal expansionRevenue;
    private BigDecimal churnedRevenue;
    private int totalPayments;
    private double successRate;
    private BigDecimal avgTransactionValue;
    private double refundRate;
}
