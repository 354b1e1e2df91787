package com.tournament.analytics.domain.model.cohort;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Retention curve and revenue of one signup cohort.
 *
 * Checkpoint retentions are null until that many months of data exist.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortAnalysis {

    private String tenantId;
    private LocalDate cohortMonth;
    private int cohortSize;
    private List<RetentionPoint> retentionCurve;

    private double avgRetentionRate;
    private Double month1Retention;
    private Double month3Retention;
    private Double month6Retention;
    private Double month12Retention;

    private BigDecimal totalRevenue;
    private BigDecimal avgRevenuePerUser;
    private BigDecimal ltv;

    private CohortMaturity maturity;
}
