package com.tournament.analytics.domain.model.dashboard;

import com.tournament.analytics.infrastructure.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Freshness of a tenant's aggregates. The status follows the stalest of the three
 * aggregate kinds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsHealth {

    private String tenantId;
    private Status status;
    private Freshness revenue;
    private Freshness cohorts;
    private Freshness tournaments;
    private CacheStats cacheStats;
    private boolean cacheReachable;
    private List<String> recommendations;

    public enum Status {
        HEALTHY,
        STALE,
        MISSING;

        public static Status fromHoursAgo(double hoursAgo) {
            if (hoursAgo < 24) {
                return HEALTHY;
            }
            return hoursAgo < 72 ? STALE : MISSING;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Freshness {

        /**
         * Null when no aggregate of this kind exists.
         */
        private Instant lastUpdate;

        /**
         * 999 when no aggregate of this kind exists.
         */
        private double hoursAgo;
        private int completeness;
    }
}
