package com.tournament.analytics.domain.model.tournament;

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
public class PlayerEngagement {

    private LocalDate from;
    private LocalDate to;

    private int uniquePlayers;
    private int totalParticipations;
    private double avgTournamentsPerPlayer;
    private double repeatParticipationRate;
    private double newPlayerRate;
    private double retentionRate;

    private Segments segments;
    private List<TopPlayer> topPlayers;

    /**
     * Players bucketed by number of tournaments entered.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Segments {
        private int oneTournament;
        private int twoToFive;
        private int sixToTen;
        private int moreThanTen;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopPlayer {
        private String playerId;
        private String playerName;
        private int tournamentCount;
    }
}
