package com.tournament.analytics.domain.model.tournament;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One period of a tournament trend series. Growth rates compare with the previous period
 * of the series and are 0 for the first one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentTrend {

    private LocalDate periodStart;
    private int tournamentCount;
    private double completionRate;
    private double avgPlayers;
    private BigDecimal totalRevenue;

    private double tournamentGrowth;
    private double playerGrowth;
    private double revenueGrowth;
}
