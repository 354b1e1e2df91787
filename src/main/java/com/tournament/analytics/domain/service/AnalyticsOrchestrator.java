package com.tournament.analytics.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tournament.analytics.domain.exception.AnalyticsException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.TrendDirection;
import com.tournament.analytics.domain.model.cohort.CohortAnalysis;
import com.tournament.analytics.domain.model.cohort.CohortComparison;
import com.tournament.analytics.domain.model.cohort.RetentionBenchmarks;
import com.tournament.analytics.domain.model.cohort.RetentionPrediction;
import com.tournament.analytics.domain.model.cohort.RetentionTrend;
import com.tournament.analytics.domain.model.dashboard.AnalyticsHealth;
import com.tournament.analytics.domain.model.dashboard.CohortAnalytics;
import com.tournament.analytics.domain.model.dashboard.DashboardSummary;
import com.tournament.analytics.domain.model.dashboard.RevenueAnalytics;
import com.tournament.analytics.domain.model.dashboard.TournamentAnalytics;
import com.tournament.analytics.domain.model.forecast.RevenueForecast;
import com.tournament.analytics.domain.model.forecast.UserGrowthForecast;
import com.tournament.analytics.domain.model.revenue.MrrMetrics;
import com.tournament.analytics.domain.model.revenue.RevenueBreakdown;
import com.tournament.analytics.domain.model.revenue.RevenueProjection;
import com.tournament.analytics.domain.model.tournament.AnalysisOptions;
import com.tournament.analytics.domain.model.tournament.AttendancePrediction;
import com.tournament.analytics.domain.model.tournament.FormatPopularity;
import com.tournament.analytics.domain.model.tournament.PlayerEngagement;
import com.tournament.analytics.domain.model.tournament.TournamentBenchmarks;
import com.tournament.analytics.domain.model.tournament.TournamentMetrics;
import com.tournament.analytics.domain.model.tournament.TournamentPerformance;
import com.tournament.analytics.domain.model.tournament.TournamentTrend;
import com.tournament.analytics.domain.service.cohort.CohortAnalyzer;
import com.tournament.analytics.domain.service.forecast.RevenueCalculator;
import com.tournament.analytics.domain.service.forecast.RevenueForecaster;
import com.tournament.analytics.domain.service.tournament.TournamentAnalyzer;
import com.tournament.analytics.infrastructure.cache.AnalyticsCacheManager;
import com.tournament.analytics.infrastructure.cache.CacheResult;
import com.tournament.analytics.infrastructure.cache.CacheStats;
import com.tournament.analytics.infrastructure.cache.CacheTtl;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import com.tournament.analytics.infrastructure.persistence.repository.RevenueAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Tenant-scoped analytics facade.
 *
 * Every query goes through {@link AnalyticsCacheManager#getOrSetResult} under a key of the
 * form {@code analytics:<kind>:<tenant>[:params]} and a {@link CacheTtl} tier chosen per
 * kind. Keeping the tenant as the third segment lets {@link #refreshAnalytics} drop all of
 * a tenant's entries with one prefix pattern per kind.
 *
 * Composite views degrade: a failed secondary analysis leaves its field null, while a
 * NotFound or InsufficientData on the primary metric propagates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsOrchestrator {

    private static final String ROOT = AnalyticsCacheManager.ROOT_NAMESPACE;
    static final String NS_REVENUE = ROOT + ":revenue";
    static final String NS_COHORTS = ROOT + ":cohorts";
    static final String NS_COHORT = ROOT + ":cohort";
    static final String NS_TOURNAMENTS = ROOT + ":tournaments";
    static final String NS_TOURNAMENT = ROOT + ":tournament";
    static final String NS_FORECAST = ROOT + ":forecast";
    private static final List<String> TENANT_NAMESPACES = List.of(
            NS_REVENUE, NS_COHORTS, NS_COHORT, NS_TOURNAMENTS, NS_TOURNAMENT, NS_FORECAST);

    private static final int RECENT_COHORTS = 6;
    private static final int PROJECTION_MONTHS = 6;
    private static final double MISSING_HOURS = 999;

    private final RevenueCalculator revenueCalculator;
    private final RevenueForecaster revenueForecaster;
    private final CohortAnalyzer cohortAnalyzer;
    private final TournamentAnalyzer tournamentAnalyzer;
    private final AnalyticsCacheManager cacheManager;
    private final RevenueAggregateRepository revenueAggregateRepository;
    private final UserCohortRepository userCohortRepository;
    private final TournamentAggregateRepository tournamentAggregateRepository;
    private final Clock clock;

    public RevenueAnalytics getRevenueAnalytics(String tenantId, LocalDate month) {
        YearMonth period = YearMonth.from(month);
        String key = cacheManager.generateCacheKey(NS_REVENUE, tenantId, period);

        CacheResult<RevenueAnalytics> result = cacheManager.getOrSetResult(key, RevenueAnalytics.class,
                () -> computeRevenueAnalytics(tenantId, period), CacheTtl.SHORT);
        return markCached(result, RevenueAnalytics::setCached);
    }

    public CohortAnalytics getCohortAnalytics(String tenantId) {
        String key = cacheManager.generateCacheKey(NS_COHORTS, tenantId);

        CacheResult<CohortAnalytics> result = cacheManager.getOrSetResult(key, CohortAnalytics.class,
                () -> computeCohortAnalytics(tenantId), CacheTtl.LONG);
        return markCached(result, CohortAnalytics::setCached);
    }

    public TournamentAnalytics getTournamentAnalytics(String tenantId, LocalDate month) {
        YearMonth period = YearMonth.from(month);
        String key = cacheManager.generateCacheKey(NS_TOURNAMENTS, tenantId, period);

        CacheResult<TournamentAnalytics> result = cacheManager.getOrSetResult(key, TournamentAnalytics.class,
                () -> computeTournamentAnalytics(tenantId, period), CacheTtl.SHORT);
        return markCached(result, TournamentAnalytics::setCached);
    }

    public RevenueForecast getRevenueForecast(String tenantId, int months) {
        String key = cacheManager.generateCacheKey(NS_FORECAST, tenantId, "revenue", months);
        return cacheManager.getOrSet(key, RevenueForecast.class,
                () -> revenueForecaster.predictRevenue(tenantId, months), CacheTtl.LONG);
    }

    public UserGrowthForecast getUserGrowthForecast(String tenantId, int months) {
        String key = cacheManager.generateCacheKey(NS_FORECAST, tenantId, "users", months);
        return cacheManager.getOrSet(key, UserGrowthForecast.class,
                () -> revenueForecaster.predictUserGrowth(tenantId, months), CacheTtl.LONG);
    }

    public CohortAnalysis getCohortAnalysis(String tenantId, LocalDate cohortMonth) {
        String key = cacheManager.generateCacheKey(NS_COHORT, tenantId, YearMonth.from(cohortMonth));
        return cacheManager.getOrSet(key, CohortAnalysis.class,
                () -> cohortAnalyzer.analyzeCohort(tenantId, cohortMonth), CacheTtl.LONG);
    }

    public RetentionPrediction getRetentionPrediction(String tenantId, LocalDate cohortMonth, int months) {
        String key = cacheManager.generateCacheKey(NS_COHORT, tenantId, YearMonth.from(cohortMonth),
                "prediction", months);
        return cacheManager.getOrSet(key, RetentionPrediction.class,
                () -> cohortAnalyzer.predictFutureRetention(tenantId, cohortMonth, months), CacheTtl.LONG);
    }

    public RetentionBenchmarks getRetentionBenchmarks(String tenantId) {
        String key = cacheManager.generateCacheKey(NS_COHORT, tenantId, "benchmarks");
        return cacheManager.getOrSet(key, RetentionBenchmarks.class,
                () -> cohortAnalyzer.getRetentionBenchmarks(tenantId), CacheTtl.LONG);
    }

    public TournamentPerformance getTournamentPerformance(String tenantId, AnalysisOptions options) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "performance", options.cacheKeyPart());
        return cacheManager.getOrSet(key, TournamentPerformance.class,
                () -> tournamentAnalyzer.analyzeTournamentPerformance(tenantId, options), CacheTtl.SHORT);
    }

    public List<FormatPopularity> getFormatPopularity(String tenantId, LocalDate from, LocalDate to) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "formats", from, to);
        return cacheManager.getOrSet(key, new TypeReference<List<FormatPopularity>>() { },
                () -> tournamentAnalyzer.analyzeFormatPopularity(tenantId, from, to), CacheTtl.MEDIUM);
    }

    public List<TournamentTrend> getTournamentTrends(String tenantId, PeriodType periodType, int periods) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "trends", periodType, periods);
        return cacheManager.getOrSet(key, new TypeReference<List<TournamentTrend>>() { },
                () -> tournamentAnalyzer.analyzeTournamentTrends(tenantId, periodType, periods), CacheTtl.MEDIUM);
    }

    public TournamentMetrics getTournamentMetrics(String tenantId, String tournamentId) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "metrics",
                tournamentId != null ? tournamentId : "all");
        return cacheManager.getOrSet(key, TournamentMetrics.class,
                () -> tournamentAnalyzer.calculateTournamentMetrics(tenantId, tournamentId), CacheTtl.SHORT);
    }

    public AttendancePrediction getAttendancePrediction(String tenantId, String format, LocalDate date) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "attendance", format, date);
        return cacheManager.getOrSet(key, AttendancePrediction.class,
                () -> tournamentAnalyzer.predictTournamentAttendance(tenantId, format, date), CacheTtl.MEDIUM);
    }

    public PlayerEngagement getPlayerEngagement(String tenantId, LocalDate from, LocalDate to) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "engagement", from, to);
        return cacheManager.getOrSet(key, PlayerEngagement.class,
                () -> tournamentAnalyzer.analyzePlayerEngagement(tenantId, from, to), CacheTtl.MEDIUM);
    }

    public TournamentBenchmarks getTournamentBenchmarks(String tenantId) {
        String key = cacheManager.generateCacheKey(NS_TOURNAMENT, tenantId, "benchmarks");
        return cacheManager.getOrSet(key, TournamentBenchmarks.class,
                () -> tournamentAnalyzer.getTournamentBenchmarks(tenantId), CacheTtl.LONG);
    }

    /**
     * Headline KPIs for the current month. Revenue is required; cohort and tournament
     * figures are left null when unavailable.
     */
    public DashboardSummary getDashboardSummary(String tenantId) {
        log.info("Building dashboard summary for tenant {}", tenantId);
        LocalDate today = LocalDate.now(clock);

        RevenueAnalytics revenue = getRevenueAnalytics(tenantId, today);
        CohortAnalytics cohorts = optional("cohort analytics", tenantId, () -> getCohortAnalytics(tenantId));
        TournamentAnalytics tournaments = optional("tournament analytics", tenantId,
                () -> getTournamentAnalytics(tenantId, today));

        CohortAnalysis latestCohort = cohorts != null && !cohorts.getCohorts().isEmpty()
                ? cohorts.getCohorts().get(0)
                : null;
        Double retentionRate = latestCohort != null ? latestCohort.getMonth1Retention() : null;
        Double churnRate = retentionRate != null ? MoneyUtils.round2(100 - retentionRate) : null;

        TrendDirection revenueTrend = revenue.getRevenueGrowth() != null
                ? TrendDirection.of(revenue.getRevenueGrowth(), 2)
                : TrendDirection.FLAT;
        TrendDirection retentionTrend = retentionTrend(cohorts);
        TrendDirection tournamentTrend = tournaments != null && tournaments.getTournamentGrowth() != null
                ? TrendDirection.of(tournaments.getTournamentGrowth(), 5)
                : TrendDirection.FLAT;

        List<DashboardSummary.Alert> alerts = new ArrayList<>();
        if (churnRate != null && churnRate > 70) {
            alerts.add(alert(DashboardSummary.AlertType.WARNING,
                    "High churn rate detected. Review onboarding and engagement strategies."));
        }
        if (revenueTrend == TrendDirection.UP && revenue.getRevenueGrowth() > 20) {
            alerts.add(alert(DashboardSummary.AlertType.SUCCESS,
                    String.format(Locale.ROOT, "Strong revenue growth of %.1f%%", revenue.getRevenueGrowth())));
        }
        if (tournaments != null && tournaments.getTotalTournaments() > 0 && tournaments.getCompletionRate() < 50) {
            alerts.add(alert(DashboardSummary.AlertType.WARNING,
                    "Low tournament completion rate. Investigate user experience issues."));
        }

        MrrMetrics mrr = revenue.getCurrent();
        return DashboardSummary.builder()
                .tenantId(tenantId)
                .periodStart(mrr.getPeriodStart())
                .periodEnd(mrr.getPeriodEnd())
                .mrr(mrr.getMrr())
                .arr(mrr.getArr())
                .totalRevenue(revenue.getTotalRevenue())
                .mrrGrowth(revenue.getMrrGrowth())
                .activeUsers(latestCohort != null ? latestCohort.getCohortSize() : null)
                .retentionRate(retentionRate)
                .churnRate(churnRate)
                .avgLtv(latestCohort != null ? latestCohort.getLtv() : null)
                .totalTournaments(tournaments != null ? tournaments.getTotalTournaments() : null)
                .completionRate(tournaments != null ? tournaments.getCompletionRate() : null)
                .revenueTrend(revenueTrend)
                .retentionTrend(retentionTrend)
                .tournamentTrend(tournamentTrend)
                .alerts(alerts)
                .cached(revenue.isCached()
                        && cohorts != null && cohorts.isCached()
                        && tournaments != null && tournaments.isCached())
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Freshness of the three aggregate kinds against 24h and 72h thresholds, plus the
     * current cache hit rate.
     */
    public AnalyticsHealth getAnalyticsHealth(String tenantId) {
        Instant now = clock.instant();

        AnalyticsHealth.Freshness revenue = freshness(revenueAggregateRepository
                .findFirstByTenantIdOrderByUpdatedAtDesc(tenantId)
                .map(RevenueAggregateEntity::getUpdatedAt), now);
        AnalyticsHealth.Freshness cohorts = freshness(userCohortRepository
                .findFirstByTenantIdOrderByUpdatedAtDesc(tenantId)
                .map(UserCohortEntity::getUpdatedAt), now);
        AnalyticsHealth.Freshness tournaments = freshness(tournamentAggregateRepository
                .findFirstByTenantIdOrderByUpdatedAtDesc(tenantId)
                .map(TournamentAggregateEntity::getUpdatedAt), now);

        double stalest = Math.max(revenue.getHoursAgo(), Math.max(cohorts.getHoursAgo(), tournaments.getHoursAgo()));
        AnalyticsHealth.Status status = AnalyticsHealth.Status.fromHoursAgo(stalest);
        CacheStats stats = cacheManager.getStats();
        boolean reachable = cacheManager.isHealthy();

        List<String> recommendations = new ArrayList<>();
        if (status == AnalyticsHealth.Status.STALE) {
            recommendations.add("Run the aggregation job to update analytics data");
        } else if (status == AnalyticsHealth.Status.MISSING) {
            recommendations.add("Analytics data is outdated or missing. Run aggregation immediately.");
        }
        if (stats.getHitRate() < 50) {
            recommendations.add("Low cache hit rate. Consider warming the cache or increasing TTLs.");
        }
        if (!reachable) {
            recommendations.add("Cache backend is unreachable. Queries are computed directly.");
        }

        return AnalyticsHealth.builder()
                .tenantId(tenantId)
                .status(status)
                .revenue(revenue)
                .cohorts(cohorts)
                .tournaments(tournaments)
                .cacheStats(stats)
                .cacheReachable(reachable)
                .recommendations(recommendations)
                .build();
    }

    /**
     * Drops every cached entry of a tenant. Patterns are anchored to {@code <namespace>:<tenant>}
     * so a parameter segment equal to the tenant id never matches. Returns the number of keys
     * removed, 0 when the cache could not be reached.
     */
    public long refreshAnalytics(String tenantId) {
        String tenantPattern = AnalyticsCacheManager.escapeGlob(tenantId);
        long removed = 0;
        for (String namespace : TENANT_NAMESPACES) {
            if (Boolean.TRUE.equals(cacheManager.delete(namespace + ":" + tenantId).orElse(false))) {
                removed++;
            }
            removed += cacheManager.invalidate(namespace + ":" + tenantPattern + ":*").orElse(0L);
        }
        log.info("Refreshed analytics cache for tenant {} ({} keys)", tenantId, removed);
        return removed;
    }

    /**
     * Precomputes the current month's revenue, cohort and tournament views and the revenue
     * forecast.
     * Views without data are skipped.
     */
    public int warmCache(String tenantId) {
        log.info("Warming analytics cache for tenant {}", tenantId);
        LocalDate today = LocalDate.now(clock);
        int warmed = 0;

        warmed += warm("revenue", tenantId, () -> getRevenueAnalytics(tenantId, today));
        warmed += warm("cohorts", tenantId, () -> getCohortAnalytics(tenantId));
        warmed += warm("tournaments", tenantId, () -> getTournamentAnalytics(tenantId, today));
        warmed += warm("revenue forecast", tenantId, () -> getRevenueForecast(tenantId, PROJECTION_MONTHS));

        log.info("Cache warmed for tenant {}: {} views", tenantId, warmed);
        return warmed;
    }

    private RevenueAnalytics computeRevenueAnalytics(String tenantId, YearMonth period) {
        log.info("Computing revenue analytics for tenant {} ({})", tenantId, period);
        LocalDate month = period.atDay(1);

        MrrMetrics current = revenueCalculator.calculateMRR(tenantId, month);
        RevenueBreakdown breakdown = revenueCalculator.getRevenueBreakdown(tenantId, month);

        RevenueAnalytics.RevenueAnalyticsBuilder analytics = RevenueAnalytics.builder()
                .tenantId(tenantId)
                .current(current)
                .totalRevenue(breakdown.getTotal())
                .mrrGrowth(current.getGrowthRate())
                .breakdown(breakdown)
                .generatedAt(clock.instant());

        revenueAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStart(tenantId, PeriodType.MONTH, month.minusMonths(1))
                .ifPresent(previous -> {
                    double before = MoneyUtils.toDouble(previous.getTotalRevenue());
                    analytics.previousTotalRevenue(MoneyUtils.scale(MoneyUtils.orZero(previous.getTotalRevenue())));
                    analytics.revenueGrowth(before > 0
                            ? MoneyUtils.round2((breakdown.getTotal().doubleValue() - before) / before * 100.0)
                            : null);
                });

        analytics.projection(optional("revenue projection", tenantId,
                () -> revenueCalculator.calculateRevenueProjection(tenantId, PROJECTION_MONTHS)));
        return analytics.build();
    }

    private CohortAnalytics computeCohortAnalytics(String tenantId) {
        log.info("Computing cohort analytics for tenant {}", tenantId);
        List<LocalDate> months = cohortAnalyzer.getRecentCohortMonths(tenantId, RECENT_COHORTS);

        List<CohortAnalysis> cohorts = new ArrayList<>();
        for (LocalDate month : months) {
            CohortAnalysis analysis = optional("cohort " + month, tenantId,
                    () -> cohortAnalyzer.analyzeCohort(tenantId, month));
            if (analysis != null) {
                cohorts.add(analysis);
            }
        }

        CohortComparison comparison = null;
        if (cohorts.size() >= 2) {
            List<LocalDate> oldestFirst = new ArrayList<>();
            for (int i = cohorts.size() - 1; i >= 0; i--) {
                oldestFirst.add(cohorts.get(i).getCohortMonth());
            }
            comparison = optional("cohort comparison", tenantId,
                    () -> cohortAnalyzer.compareCohortsRetention(tenantId, oldestFirst));
        }
        RetentionBenchmarks benchmarks = optional("retention benchmarks", tenantId,
                () -> cohortAnalyzer.getRetentionBenchmarks(tenantId));
        RetentionPrediction prediction = null;
        if (!cohorts.isEmpty()) {
            LocalDate newest = cohorts.get(0).getCohortMonth();
            prediction = optional("retention prediction", tenantId,
                    () -> cohortAnalyzer.predictFutureRetention(tenantId, newest, PROJECTION_MONTHS));
        }

        return CohortAnalytics.builder()
                .tenantId(tenantId)
                .cohorts(cohorts)
                .comparison(comparison)
                .benchmarks(benchmarks)
                .prediction(prediction)
                .generatedAt(clock.instant())
                .build();
    }

    private TournamentAnalytics computeTournamentAnalytics(String tenantId, YearMonth period) {
        log.info("Computing tournament analytics for tenant {} ({})", tenantId, period);
        LocalDate month = period.atDay(1);

        TournamentAggregateEntity aggregate = tournamentAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStart(tenantId, PeriodType.MONTH, month)
                .orElseThrow(() -> new NotFoundException(
                        "No tournament data found for tenant " + tenantId + " in " + period));

        TournamentAnalytics.TournamentAnalyticsBuilder analytics = TournamentAnalytics.builder()
                .tenantId(tenantId)
                .periodStart(aggregate.getPeriodStart())
                .periodEnd(aggregate.getPeriodEnd())
                .totalTournaments(aggregate.getTournamentCount())
                .completedTournaments(aggregate.getCompletedCount())
                .completionRate(MoneyUtils.toDouble(aggregate.getCompletionRate()))
                .totalPlayers(aggregate.getTotalPlayers())
                .avgPlayers(MoneyUtils.toDouble(aggregate.getAvgPlayers()))
                .avgDurationMinutes(MoneyUtils.toDouble(aggregate.getAvgDurationMinutes()))
                .popularFormat(aggregate.getMostPopularFormat())
                .revenue(MoneyUtils.scale(MoneyUtils.orZero(aggregate.getRevenue())))
                .generatedAt(clock.instant());

        tournamentAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStart(tenantId, PeriodType.MONTH, month.minusMonths(1))
                .ifPresent(previous -> {
                    double previousRevenue = MoneyUtils.toDouble(previous.getRevenue());
                    analytics.previousTournaments(previous.getTournamentCount())
                            .previousCompletionRate(MoneyUtils.toDouble(previous.getCompletionRate()))
                            .previousRevenue(MoneyUtils.scale(MoneyUtils.orZero(previous.getRevenue())))
                            .tournamentGrowth(previous.getTournamentCount() > 0
                                    ? MoneyUtils.round2(Statistics.percentChange(
                                            aggregate.getTournamentCount(), previous.getTournamentCount()))
                                    : null)
                            .revenueGrowth(previousRevenue > 0
                                    ? MoneyUtils.round2(Statistics.percentChange(
                                            MoneyUtils.toDouble(aggregate.getRevenue()), previousRevenue))
                                    : null);
                });

        return analytics.build();
    }

    private static TrendDirection retentionTrend(CohortAnalytics cohorts) {
        if (cohorts == null || cohorts.getComparison() == null) {
            return TrendDirection.FLAT;
        }
        RetentionTrend trend = cohorts.getComparison().getRetentionTrend();
        if (trend == RetentionTrend.IMPROVING) {
            return TrendDirection.UP;
        }
        return trend == RetentionTrend.DECLINING ? TrendDirection.DOWN : TrendDirection.FLAT;
    }

    private static AnalyticsHealth.Freshness freshness(Optional<Instant> lastUpdate, Instant now) {
        if (lastUpdate.isEmpty()) {
            return AnalyticsHealth.Freshness.builder()
                    .hoursAgo(MISSING_HOURS)
                    .completeness(0)
                    .build();
        }
        double hours = Duration.between(lastUpdate.get(), now).toMillis() / 3_600_000.0;
        return AnalyticsHealth.Freshness.builder()
                .lastUpdate(lastUpdate.get())
                .hoursAgo(Math.round(hours * 10) / 10.0)
                .completeness(100)
                .build();
    }

    private static DashboardSummary.Alert alert(DashboardSummary.AlertType type, String message) {
        return DashboardSummary.Alert.builder().type(type).message(message).build();
    }

    private static <T> T markCached(CacheResult<T> result, BiConsumer<T, Boolean> flag) {
        T value = result.orElse(null);
        if (value != null) {
            flag.accept(value, result.isHit());
        }
        return value;
    }

    private <T> T optional(String what, String tenantId, Supplier<T> analysis) {
        try {
            return analysis.get();
        } catch (AnalyticsException e) {
            log.warn("Skipping {} for tenant {}: {}", what, tenantId, e.getMessage());
            return null;
        }
    }

    private int warm(String what, String tenantId, Supplier<?> view) {
        return optional(what, tenantId, view) != null ? 1 : 0;
    }
}
