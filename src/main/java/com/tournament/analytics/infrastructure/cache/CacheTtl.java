package com.tournament.analytics.infrastructure.cache;

import java.time.Duration;

/**
 * Named TTL tiers. The orchestrator picks one per query type.
 */
public enum CacheTtl {
    REAL_TIME(60),
    SHORT(300),
    MEDIUM(1800),
    LONG(3600),
    VERY_LONG(86400);

    private final long seconds;

    CacheTtl(long seconds) {
        this.seconds = seconds;
    }

    public long getSeconds() {
        return seconds;
    }

    public Duration toDuration() {
        return Duration.ofSeconds(seconds);
    }
}
