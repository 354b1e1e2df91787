package com.tournament.analytics.domain.model.dashboard;

import com.tournament.analytics.domain.model.cohort.CohortAnalysis;
import com.tournament.analytics.domain.model.cohort.CohortComparison;
import com.tournament.analytics.domain.model.cohort.RetentionBenchmarks;
import com.tournament.analytics.domain.model.cohort.RetentionPrediction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * The most recent cohorts, newest first, with optional comparison, benchmarks and a
 * retention prediction for the newest cohort.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortAnalytics {

    private String tenantId;
    private List<CohortAnalysis> cohorts;
    private CohortComparison comparison;
    private RetentionBenchmarks benchmarks;
    private RetentionPrediction prediction;

    private boolean cached;
    private Instant generatedAt;
}
