package com.tournament.analytics.domain.model.tournament;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendancePrediction {

    private String format;
    private LocalDate date;
    private DayOfWeek dayOfWeek;
    private long predictedAttendance;
    private long low;
    private long high;
    private Confidence confidence;
    private int historicalTournaments;

    private double historicalAverage;
    private double formatPopularity;

    /**
     * Same-weekday average relative to the historical average, in percent.
     */
    private double dayOfWeekTrend;

    /**
     * Same-month average relative to the historical average, in percent.
     */
    private double seasonalFactor;
    private String recommendation;
}
