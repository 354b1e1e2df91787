package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * When a scheduled report fires. Times are wall-clock in {@link #timezone}.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSchedule {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Frequency frequency;

    /**
     * Cron expression, only used with {@link Frequency#CUSTOM}. Five-field (minute-first)
     * and six-field (second-first) expressions are both accepted.
     */
    @Column(length = 100)
    private String cronExpression;

    /**
     * ISO day of week for weekly reports, 1 = Monday.
     */
    @Builder.Default
    private Integer dayOfWeek = 1;

    @Builder.Default
    private Integer dayOfMonth = 1;

    @Builder.Default
    private int hour = 9;

    @Builder.Default
    private int minute = 0;

    @Builder.Default
    @Column(length = 64)
    private String timezone = "UTC";

    public enum Frequency {
        DAILY,
        WEEKLY,
        MONTHLY,
        CUSTOM
    }
}
