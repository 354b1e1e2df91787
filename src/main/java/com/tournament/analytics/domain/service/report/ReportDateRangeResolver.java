package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.model.aggregation.PeriodBoundary;
import com.tournament.analytics.infrastructure.persistence.entity.ReportDateRange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Resolves a report's date range policy to concrete inclusive dates. Rolling ranges end
 * yesterday; calendar ranges cover the last complete month or quarter.
 */
@Component
@RequiredArgsConstructor
public class ReportDateRangeResolver {

    private final Clock clock;

    public PeriodBoundary resolve(ReportDateRange range) {
        LocalDate today = LocalDate.now(clock);
        LocalDate yesterday = today.minusDays(1);
        ReportDateRange.RangeType type = range != null && range.getRangeType() != null
                ? range.getRangeType()
                : ReportDateRange.RangeType.LAST_30_DAYS;

        return switch (type) {
            case LAST_7_DAYS -> boundary(today.minusDays(7), yesterday);
            case LAST_30_DAYS -> boundary(today.minusDays(30), yesterday);
            case LAST_MONTH -> {
                YearMonth previous = YearMonth.from(today).minusMonths(1);
                yield boundary(previous.atDay(1), previous.atEndOfMonth());
            }
            case LAST_QUARTER -> {
                int currentQuarterFirstMonth = (today.getMonthValue() - 1) / 3 * 3 + 1;
                LocalDate quarterStart = LocalDate.of(today.getYear(), currentQuarterFirstMonth, 1).minusMonths(3);
                yield boundary(quarterStart, quarterStart.plusMonths(3).minusDays(1));
            }
            case CUSTOM -> custom(range);
        };
    }

    private static PeriodBoundary custom(ReportDateRange range) {
        if (range.getCustomStart() == null || range.getCustomEnd() == null) {
            throw new AnalyticsValidationException("Custom date ranges require a start and an end date");
        }
        if (range.getCustomEnd().isBefore(range.getCustomStart())) {
            throw new AnalyticsValidationException("Custom date range ends before it starts");
        }
        return boundary(range.getCustomStart(), range.getCustomEnd());
    }

    private static PeriodBoundary boundary(LocalDate start, LocalDate end) {
        return PeriodBoundary.builder().start(start).end(end).build();
    }
}
