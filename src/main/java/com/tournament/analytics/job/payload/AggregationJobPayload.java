package com.tournament.analytics.job.payload;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Aggregation request. A null tenant means every active tenant; a missing period means
 * the day containing today.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationJobPayload {

    private String tenantId;

    @Builder.Default
    private AggregationType type = AggregationType.ALL;

    private PeriodType periodType;
    private LocalDate periodStart;
    private LocalDate periodEnd;

    public enum AggregationType {
        REVENUE,
        COHORTS,
        TOURNAMENTS,
        ALL
    }
}
