package com.tournament.analytics.domain.model.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Least-squares line {@code y = slope * x + intercept} over index-valued x.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trendline {

    private double slope;
    private double intercept;

    /**
     * Coefficient of determination, clamped to [0, 1].
     */
    private double rSquared;
    private String equation;

    public double valueAt(double x) {
        return slope * x + intercept;
    }
}
