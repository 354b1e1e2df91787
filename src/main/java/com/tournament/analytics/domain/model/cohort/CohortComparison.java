package com.tournament.analytics.domain.model.cohort;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortComparison {

    private List<CohortSnapshot> cohorts;
    private LocalDate bestPerformingCohort;
    private LocalDate worstPerformingCohort;
    private RetentionTrend retentionTrend;

    /**
     * Population standard deviation of month-1 retention across the compared cohorts.
     */
    private double retentionVolatility;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CohortSnapshot {
        private LocalDate cohortMonth;
        private int cohortSize;
        private double avgRetention;
        private Double month1Retention;
        private Double month3Retention;
        private BigDecimal currentLtv;
    }
}
