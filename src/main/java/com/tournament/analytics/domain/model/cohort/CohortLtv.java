package com.tournament.analytics.domain.model.cohort;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortLtv {

    private LocalDate cohortMonth;
    private int cohortSize;
    private BigDecimal currentLtv;
    private BigDecimal projectedLtv;
    private List<MonthlyRevenue> revenueByMonth;
    private Confidence confidence;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MonthlyRevenue {
        private int monthNumber;
        private BigDecimal revenue;
        private BigDecimal cumulativeRevenue;
        private BigDecimal revenuePerUser;
    }
}
