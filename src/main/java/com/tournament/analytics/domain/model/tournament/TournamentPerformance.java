package com.tournament.analytics.domain.model.tournament;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentPerformance {

    private LocalDate periodStart;
    private LocalDate periodEnd;
    private PeriodType periodType;
    private PerformanceMetrics metrics;

    /**
     * Present only when a comparison with the previous period was requested.
     */
    private PerformanceComparison comparison;
    private List<FormatPopularity> formatBreakdown;
    private List<String> insights;
}
