package com.tournament.analytics.domain.model.tournament;

import com.tournament.analytics.domain.model.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricComparison {

    private double previousValue;
    private double change;
    private TrendDirection trend;
}
