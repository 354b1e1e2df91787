package com.tournament.analytics.api;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.job.payload.AggregationJobPayload.AggregationType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Job submission body. Aggregation jobs use the aggregation and period fields; report
 * jobs need {@code reportId}. The tenant always comes from the request header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest {

    @NotNull
    private JobType type;

    private AggregationType aggregationType;
    private PeriodType periodType;
    private LocalDate periodStart;
    private LocalDate periodEnd;

    private UUID reportId;
}
