package com.tournament.analytics.domain.model.aggregation;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Inclusive date range of one aggregation bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodBoundary {

    private PeriodType periodType;
    private LocalDate start;
    private LocalDate end;

    public static PeriodBoundary containing(LocalDate date, PeriodType periodType) {
        return new PeriodBoundary(periodType, periodType.startOf(date), periodType.endOf(date));
    }
}
