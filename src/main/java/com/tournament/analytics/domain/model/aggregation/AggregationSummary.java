package com.tournament.analytics.domain.model.aggregation;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What one {@code aggregateAll} run wrote for a tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationSummary {

    private String tenantId;
    private PeriodType periodType;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private BigDecimal totalRevenue;
    private int tournamentCount;
    private LocalDate cohortMonth;
    private int cohortRowsWritten;
    private long durationMs;
}
