package com.tournament.analytics.domain.model.revenue;

import com.tournament.analytics.domain.model.Confidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifetimeValue {

    private LocalDate cohortMonth;
    private BigDecimal avgLtv;
    private BigDecimal totalRevenue;
    private int cohortSize;
    private BigDecimal avgRevenuePerUser;
    private BigDecimal projectedLtv;
    private int monthsActive;
    private Confidence confidence;
}
