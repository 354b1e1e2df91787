package com.tournament.analytics.job.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cache warm-up request. A null tenant warms every active tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheWarmJobPayload {

    private String tenantId;
}
