package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDateRange {

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private RangeType rangeType = RangeType.LAST_30_DAYS;

    private LocalDate customStart;

    private LocalDate customEnd;

    public enum RangeType {
        LAST_7_DAYS,
        LAST_30_DAYS,
        LAST_MONTH,
        LAST_QUARTER,
        CUSTOM
    }
}
