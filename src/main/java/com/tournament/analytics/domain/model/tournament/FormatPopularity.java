package com.tournament.analytics.domain.model.tournament;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatPopularity {

    private String format;
    private int tournamentCount;
    private int totalPlayers;
    private double avgPlayersPerTournament;
    private double completionRate;
    private double avgDurationMinutes;
    private BigDecimal totalRevenue;
    private BigDecimal avgRevenuePerTournament;

    /**
     * Share of all tournaments in the window, in percent.
     */
    private double marketShare;
}
