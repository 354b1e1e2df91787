package com.tournament.analytics.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports cache reachability. The cache is optional, so an unreachable cache is
 * reported with details but does not take the service down.
 */
@Component("analyticsCache")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    private final AnalyticsCacheManager cacheManager;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    @Override
    public Health health() {
        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("redis");
        CacheStats stats = cacheManager.getStats();
        boolean reachable = cacheManager.isHealthy();

        Health.Builder builder = reachable ? Health.up() : Health.unknown();
        return builder
                .withDetail("reachable", reachable)
                .withDetail("circuitBreaker", breaker.getState().name())
                .withDetail("hitRate", stats.getHitRate())
                .withDetail("hits", stats.getHits())
                .withDetail("misses", stats.getMisses())
                .withDetail("errors", stats.getErrors())
                .build();
    }
}
