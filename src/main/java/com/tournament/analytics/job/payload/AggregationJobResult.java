package com.tournament.analytics.job.payload;

import com.tournament.analytics.domain.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationJobResult {

    private AggregationJobPayload.AggregationType type;
    private PeriodType periodType;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private int tenantsProcessed;

    /**
     * One message per tenant that failed; the other tenants were still processed.
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
