package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "tournament_players", indexes = {
    @Index(name = "idx_player_tournament", columnList = "tournamentId"),
    @Index(name = "idx_player_player", columnList = "playerId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentPlayerEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String tournamentId;

    /**
     * Stable player identity across tournaments.
     */
    @Column(nullable = false, length = 64)
    private String playerId;

    private String playerName;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private PlayerStatus status;

    /**
     * Active and eliminated players took part in play; the others only registered.
     */
    public boolean hasPlayed() {
        return status == PlayerStatus.ACTIVE || status == PlayerStatus.ELIMINATED;
    }

    public enum PlayerStatus {
        REGISTERED,
        CHECKED_IN,
        ACTIVE,
        ELIMINATED,
        WITHDRAWN
    }
}
