package com.tournament.analytics.job;

import com.tournament.analytics.domain.service.AnalyticsOrchestrator;
import com.tournament.analytics.domain.service.ProgressListener;
import com.tournament.analytics.domain.service.aggregation.AggregationService;
import com.tournament.analytics.infrastructure.persistence.entity.AnalyticsJobEntity.JobType;
import com.tournament.analytics.job.payload.CacheWarmJobPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CacheWarmJobHandler implements AnalyticsJobHandler<CacheWarmJobPayload> {

    private final AnalyticsOrchestrator orchestrator;
    private final AggregationService aggregationService;

    @Override
    public JobType type() {
        return JobType.CACHE_WARM;
    }

    @Override
    public Class<CacheWarmJobPayload> payloadType() {
        return CacheWarmJobPayload.class;
    }

    /**
     * Returns the number of warmed views per tenant.
     */
    @Override
    public Map<String, Integer> handle(CacheWarmJobPayload payload, ProgressListener progress) {
        progress.onProgress(0);
        List<String> tenantIds = payload.getTenantId() != null
                ? List.of(payload.getTenantId())
                : aggregationService.getActiveTenants();

        Map<String, Integer> warmed = new LinkedHashMap<>();
        for (int i = 0; i < tenantIds.size(); i++) {
            warmed.put(tenantIds.get(i), orchestrator.warmCache(tenantIds.get(i)));
            progress.onProgress((int) Math.round(100.0 * (i + 1) / tenantIds.size()));
        }
        progress.onProgress(100);
        return warmed;
    }
}
