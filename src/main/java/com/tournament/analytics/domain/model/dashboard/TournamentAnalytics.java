package com.tournament.analytics.domain.model.dashboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentAnalytics {

    private String tenantId;
    private LocalDate periodStart;
    private LocalDate periodEnd;

    private int totalTournaments;
    private int completedTournaments;
    private double completionRate;
    private int totalPlayers;
    private double avgPlayers;
    private double avgDurationMinutes;
    private String popularFormat;
    private BigDecimal revenue;

    private Integer previousTournaments;
    private Double previousCompletionRate;
    private BigDecimal previousRevenue;
    private Double tournamentGrowth;
    private Double revenueGrowth;

    private boolean cached;
    private Instant generatedAt;
}
