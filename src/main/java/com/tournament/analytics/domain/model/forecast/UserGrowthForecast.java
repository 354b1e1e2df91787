package com.tournament.analytics.domain.model.forecast;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.YearMonth;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserGrowthForecast {

    private String tenantId;
    private List<UserGrowthPrediction> predictions;

    /**
     * Average month-over-month signup growth in percent, before the 5% floor is applied.
     */
    private double avgGrowthRate;
    private double avgChurnRate;
    private boolean churnMeasured;
    private int historicalMonths;
    private Confidence confidence;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserGrowthPrediction {
        private YearMonth month;
        private long predictedUsers;
        private long predictedActive;
        private long newUsers;
        private long churnedUsers;
        private long low;
        private long high;
    }
}
