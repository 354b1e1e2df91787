package com.tournament.analytics.domain.model.cohort;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionPoint {

    private int monthNumber;
    private LocalDate date;
    private int retainedUsers;
    private double retentionRate;

    /**
     * Cohort size minus retained users; always 0 in month 0.
     */
    private int churnedUsers;
    private double churnRate;
}
