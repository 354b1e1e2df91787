package com.tournament.analytics.domain.model.tournament;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Window and extras for a tournament performance analysis. The window is the day, week
 * or month containing {@code endDate} (today when absent), optionally widened back to
 * {@code startDate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOptions {

    private LocalDate startDate;
    private LocalDate endDate;

    @Builder.Default
    private PeriodType periodType = PeriodType.MONTH;

    private boolean compareToPrevious;
    private boolean includeFormatBreakdown;

    /**
     * Stable representation used in cache keys.
     */
    public String cacheKeyPart() {
        return String.join("|",
                String.valueOf(startDate),
                String.valueOf(endDate),
                String.valueOf(periodType),
                compareToPrevious ? "cmp" : "-",
                includeFormatBreakdown ? "fmt" : "-");
    }
}
