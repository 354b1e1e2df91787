package com.tournament.analytics.domain.model.forecast;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevenueForecast {

    private String tenantId;
    private List<RevenuePrediction> predictions;
    private Trendline trendline;
    private int historicalMonths;
    private int nonZeroMonths;
    private boolean seasonalityApplied;
    private Confidence confidence;

    /**
     * R² expressed as a percentage.
     */
    private int accuracy;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RevenuePrediction {
        private YearMonth month;
        private BigDecimal predictedMrr;
        private BigDecimal low;
        private BigDecimal high;
        private double seasonalFactor;
    }
}
