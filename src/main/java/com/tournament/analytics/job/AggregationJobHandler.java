package com.tournament.analytics.job;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.service.AnalyticsOrchestrator;
import com.tournament.analytics.domain.service.ProgressListener;
import com.tournament.analytics.domain.service.aggregation.AggregationService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.job.payload.AggregationJobPayload;
import com.tournament.analytics.job.payload.AggregationJobResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs the aggregation pipeline for one tenant or all of them and drops the cached
 * analytics of every tenant it recomputed.
 *
 * In an all-tenant run a failing tenant is recorded in the result and the batch moves on.
 * A single-tenant run rethrows so the job is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregationJobHandler implements AnalyticsJobHandler<AggregationJobPayload> {

    private final AggregationService aggregationService;
    private final AnalyticsOrchestrator orchestrator;
    private final Clock clock;

    @Override
    public JobType type() {
        return JobType.AGGREGATION;
    }

    @Override
    public Class<AggregationJobPayload> payloadType() {
        return AggregationJobPayload.class;
    }

    @Override
    public AggregationJobResult handle(AggregationJobPayload payload, ProgressListener progress) {
        progress.onProgress(0);

        boolean singleTenant = payload.getTenantId() != null;
        List<String> tenantIds = singleTenant
                ? List.of(payload.getTenantId())
                : aggregationService.getActiveTenants();

        PeriodType periodType = payload.getPeriodType() != null ? payload.getPeriodType() : PeriodType.DAY;
        LocalDate periodStart = payload.getPeriodStart() != null
                ? payload.getPeriodStart()
                : periodType.startOf(LocalDate.now(clock));
        LocalDate periodEnd = payload.getPeriodEnd() != null ? payload.getPeriodEnd() : periodType.endOf(periodStart);
        AggregationJobPayload.AggregationType type = payload.getType() != null
                ? payload.getType()
                : AggregationJobPayload.AggregationType.ALL;

        AggregationJobResult result = AggregationJobResult.builder()
                .type(type)
                .periodType(periodType)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .build();
        progress.onProgress(10);

        log.info("Aggregating {} for {} tenants ({} {} to {})",
                type, tenantIds.size(), periodType, periodStart, periodEnd);

        int processed = 0;
        for (int i = 0; i < tenantIds.size(); i++) {
            String tenantId = tenantIds.get(i);
            try {
                aggregate(type, tenantId, periodType, periodStart, periodEnd);
                orchestrator.refreshAnalytics(tenantId);
                processed++;
            } catch (RuntimeException e) {
                if (singleTenant) {
                    throw e;
                }
                log.error("Aggregation failed for tenant {}: {}", tenantId, e.getMessage(), e);
                result.getErrors().add("Failed to process tenant " + tenantId + ": " + e.getMessage());
            }
            progress.onProgress(10 + (int) Math.round(70.0 * (i + 1) / tenantIds.size()));
        }
        result.setTenantsProcessed(processed);
        progress.onProgress(90);

        log.info("Aggregation job finished: {}/{} tenants, {} errors",
                processed, tenantIds.size(), result.getErrors().size());
        progress.onProgress(100);
        return result;
    }

    private void aggregate(AggregationJobPayload.AggregationType type, String tenantId, PeriodType periodType,
                           LocalDate periodStart, LocalDate periodEnd) {
        switch (type) {
            case REVENUE -> aggregationService.aggregateRevenue(tenantId, periodStart, periodEnd, periodType);
            case COHORTS -> aggregationService.aggregateCohorts(tenantId, periodStart.withDayOfMonth(1));
            case TOURNAMENTS -> aggregationService.aggregateTournaments(tenantId, periodStart, periodEnd, periodType);
            case ALL -> aggregationService.aggregateAll(tenantId, periodStart, periodEnd, periodType);
        }
    }
}
