package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Queued background job (aggregation, report delivery, cache warm-up).
 *
 * A failed attempt goes back to PENDING with a later {@link #nextAttemptAt} until
 * {@link #maxAttempts} is reached, then ends in FAILED.
 */
@Entity
@Table(name = "analytics_jobs", indexes = {
    @Index(name = "idx_job_status_next_attempt", columnList = "status, nextAttemptAt"),
    @Index(name = "idx_job_dedupe_key", columnList = "dedupeKey"),
    @Index(name = "idx_job_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobType jobType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    /**
     * Identifies logically identical jobs so schedulers do not enqueue duplicates.
     */
    @Column(length = 200)
    private String dedupeKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Builder.Default
    private int progress = 0;

    @Builder.Default
    private int attempts = 0;

    @Builder.Default
    private int maxAttempts = 3;

    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(length = 1000)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant nextAttemptAt;

    private Instant startedAt;

    private Instant completedAt;

    public enum JobType {
        AGGREGATION,
        SCHEDULED_REPORT,
        CACHE_WARM
    }

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = createdAt;
        }
    }

    public void markStarted(Instant now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
        this.attempts++;
        this.progress = 0;
    }

    public void markCompleted(String result, Instant now) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.progress = 100;
        this.errorMessage = null;
        this.completedAt = now;
    }

    public void scheduleRetry(String error, Instant nextAttemptAt) {
        this.status = JobStatus.PENDING;
        this.errorMessage = truncate(error);
        this.nextAttemptAt = nextAttemptAt;
    }

    public void markFailed(String error, Instant now) {
        this.status = JobStatus.FAILED;
        this.errorMessage = truncate(error);
        this.completedAt = now;
    }

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private static String truncate(String error) {
        return error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
