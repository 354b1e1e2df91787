package com.tournament.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tournament Analytics Engine
 *
 * Turns tenant activity (payments, refunds, signups, tournaments) into period aggregates
 * and serves cached analytics on top of them.
 *
 * Architecture:
 * - Aggregation pipeline writing revenue, cohort and tournament aggregates
 * - Cohort, revenue and tournament analyzers with closed-form forecasting
 * - Redis cache with tiered TTLs and per-tenant invalidation
 * - Persistent job queue for aggregation, scheduled reports and cache warm-up
 * - REST API over the analytics orchestrator
 */
@SpringBootApplication
@EnableScheduling
public class TournamentAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TournamentAnalyticsApplication.class, args);
    }
}
