package com.tournament.analytics.domain.model.revenue;

import com.tournament.analytics.domain.model.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrowthRate {

    private String metric;
    private double currentValue;
    private double previousValue;
    private double growthRate;
    private double absoluteChange;
    private TrendDirection trend;
}
