package com.tournament.analytics.domain.model.tournament;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceComparison {

    private MetricComparison tournamentCount;
    private MetricComparison completionRate;
    private MetricComparison avgPlayers;
    private MetricComparison revenue;
}
