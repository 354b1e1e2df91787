package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "tournaments", indexes = {
    @Index(name = "idx_tournament_org_created", columnList = "orgId, createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String orgId;

    private String name;

    @Column(nullable = false, length = 100)
    private String format;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TournamentStatus status;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    public enum TournamentStatus {
        DRAFT,
        REGISTRATION,
        ACTIVE,
        PAUSED,
        COMPLETED,
        CANCELLED
    }

    public boolean isCompleted() {
        return status == TournamentStatus.COMPLETED;
    }

    /**
     * Minutes between start and completion, or null when either timestamp is missing.
     */
    public Double getDurationMinutes() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis() / 60000.0;
    }
}
