package com.tournament.analytics.domain.model.revenue;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * MRR and ARR of one month with the previous month for comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MrrMetrics {

    private BigDecimal mrr;
    private BigDecimal arr;
    private LocalDate periodStart;
    private LocalDate periodEnd;

    /**
     * Null when the previous month has not been aggregated.
     */
    private BigDecimal previousMrr;
    private BigDecimal previousArr;

    /**
     * Month-over-month MRR change in percent; null without a positive previous MRR.
     */
    private Double growthRate;
    private int paymentCount;
    private Confidence confidence;
}
