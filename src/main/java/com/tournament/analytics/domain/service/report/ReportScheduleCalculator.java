package com.tournament.analytics.domain.service.report;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Turns a {@link ReportSchedule} into a Spring {@link CronExpression} and finds its next
 * occurrence. Occurrences are evaluated in the schedule's own timezone and are always
 * strictly after the reference instant.
 */
@Component
@RequiredArgsConstructor
public class ReportScheduleCalculator {

    private final Clock clock;

    public Instant nextRunAt(ReportSchedule schedule) {
        return nextRunAfter(schedule, clock.instant());
    }

    public Instant nextRunAfter(ReportSchedule schedule, Instant after) {
        CronExpression cron = CronExpression.parse(toCron(schedule));
        ZonedDateTime next = cron.next(after.atZone(zoneOf(schedule)));
        if (next == null) {
            throw new AnalyticsValidationException("Schedule has no future occurrence: " + toCron(schedule));
        }
        return next.toInstant();
    }

    /**
     * Checks the schedule fields and that the resulting cron expression parses.
     */
    public void validate(ReportSchedule schedule) {
        if (schedule == null || schedule.getFrequency() == null) {
            throw new AnalyticsValidationException("Schedule frequency is required");
        }
        if (schedule.getHour() < 0 || schedule.getHour() > 23) {
            throw new AnalyticsValidationException("Schedule hour must be between 0 and 23");
        }
        if (schedule.getMinute() < 0 || schedule.getMinute() > 59) {
            throw new AnalyticsValidationException("Schedule minute must be between 0 and 59");
        }
        zoneOf(schedule);
        try {
            CronExpression.parse(toCron(schedule));
        } catch (IllegalArgumentException e) {
            throw new AnalyticsValidationException("Invalid cron expression: " + e.getMessage());
        }
    }

    /**
     * Six-field (second-first) cron expression equivalent to the schedule.
     */
    String toCron(ReportSchedule schedule) {
        int minute = schedule.getMinute();
        int hour = schedule.getHour();
        return switch (schedule.getFrequency()) {
            case DAILY -> String.format(Locale.ROOT, "0 %d %d * * *", minute, hour);
            case WEEKLY -> String.format(Locale.ROOT, "0 %d %d * * %s",
                    minute, hour, dayOfWeek(schedule.getDayOfWeek()));
            case MONTHLY -> String.format(Locale.ROOT, "0 %d %d %d * *",
                    minute, hour, dayOfMonth(schedule.getDayOfMonth()));
            case CUSTOM -> customCron(schedule.getCronExpression());
        };
    }

    private static String dayOfWeek(Integer isoDay) {
        int day = isoDay != null ? isoDay : 1;
        if (day < 1 || day > 7) {
            throw new AnalyticsValidationException("Day of week must be between 1 (Monday) and 7 (Sunday)");
        }
        return DayOfWeek.of(day).name().substring(0, 3);
    }

    // Capped at 28 so every month has an occurrence.
    private static int dayOfMonth(Integer day) {
        int value = day != null ? day : 1;
        if (value < 1 || value > 28) {
            throw new AnalyticsValidationException("Day of month must be between 1 and 28");
        }
        return value;
    }

    private static String customCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new AnalyticsValidationException("Custom schedules require a cron expression");
        }
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }

    private static ZoneId zoneOf(ReportSchedule schedule) {
        String timezone = schedule.getTimezone();
        try {
            return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new AnalyticsValidationException("Unknown timezone: " + timezone);
        }
    }
}
