package com.tournament.analytics.domain.model.report;

import com.tournament.analytics.domain.model.dashboard.CohortAnalytics;
import com.tournament.analytics.domain.model.dashboard.DashboardSummary;
import com.tournament.analytics.domain.model.dashboard.RevenueAnalytics;
import com.tournament.analytics.domain.model.forecast.RevenueForecast;
import com.tournament.analytics.domain.model.tournament.PlayerEngagement;
import com.tournament.analytics.domain.model.tournament.TournamentPerformance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Content of one report run. A section is null when it is disabled in the report or its
 * analysis was unavailable; unavailable sections are listed in {@link #skippedSections}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportData {

    private String tenantId;
    private String reportName;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private Instant generatedAt;

    private DashboardSummary summary;
    private RevenueAnalytics revenue;
    private PlayerEngagement users;
    private CohortAnalytics cohorts;
    private TournamentPerformance tournaments;
    private RevenueForecast predictions;

    @Builder.Default
    private List<String> skippedSections = new ArrayList<>();
}
