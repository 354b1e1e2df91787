package com.tournament.analytics.domain.model.tournament;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentMetrics {

    private int tournamentCount;

    /**
     * Registered players who actually played, in percent.
     */
    private double participationRate;
    private double completionRate;
    private double avgDurationMinutes;
    private double avgPlayersPerTournament;

    /**
     * Players who entered more than one tournament, in percent of unique players.
     */
    private double playerReturnRate;
}
