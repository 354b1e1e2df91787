package com.tournament.analytics.config;

import io.github.resilience4j.core.IntervalFunction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry timing for background jobs. The Redis circuit breaker is configured in
 * application.yml under {@code resilience4j.circuitbreaker.instances.redis}.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public IntervalFunction jobBackoff(@Value("${app.jobs.initial-backoff-ms:5000}") long initialBackoffMs,
                                       @Value("${app.jobs.backoff-multiplier:2.0}") double multiplier) {
        return IntervalFunction.ofExponentialBackoff(initialBackoffMs, multiplier);
    }
}
