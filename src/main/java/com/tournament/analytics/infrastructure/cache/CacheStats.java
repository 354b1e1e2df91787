package com.tournament.analytics.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hits;
    private long misses;
    private long sets;
    private long errors;

    /**
     * Percentage of reads served from the cache, 0 when nothing was read yet.
     */
    private double hitRate;

    private String lastError;
    private Instant lastErrorAt;
}
