package com.tournament.analytics.domain.model.tournament;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Totals over one or more tournament aggregates. Average duration is weighted by
 * tournament count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private int tournamentCount;
    private int completedCount;
    private double completionRate;
    private double avgPlayersPerTournament;
    private double avgDurationMinutes;
    private int totalPlayers;
    private BigDecimal totalRevenue;
    private BigDecimal avgRevenuePerTournament;
}
