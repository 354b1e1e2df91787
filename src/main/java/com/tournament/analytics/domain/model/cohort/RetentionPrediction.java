package com.tournament.analytics.domain.model.cohort;

import com.tournament.analytics.domain.model.Confidence;
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
public class RetentionPrediction {

    private LocalDate cohortMonth;
    private List<PredictedRetention> predictions;
    private double decayRate;
    private int historicalPoints;
    private Confidence confidence;

    @Builder.Default
    private String method = "exponential_decay";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PredictedRetention {
        private int monthNumber;
        private double predictedRetention;

        /**
         * Half-width of the band in percentage points.
         */
        private double confidenceWidth;
        private double low;
        private double high;
    }
}
