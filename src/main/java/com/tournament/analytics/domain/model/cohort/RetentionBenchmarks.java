package com.tournament.analytics.domain.model.cohort;

import com.tournament.analytics.domain.model.BenchmarkStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionBenchmarks {

    private String tenantId;
    private LocalDate cohortMonth;
    private List<Checkpoint> checkpoints;
    private String industry;
    private List<String> recommendations;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Checkpoint {
        private int month;
        private double target;

        /**
         * Null when the cohort has not reached this month yet.
         */
        private Double current;
        private BenchmarkStatus status;
    }
}
