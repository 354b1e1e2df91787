package com.tournament.analytics.domain.service.tournament;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.BenchmarkStatus;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.TrendDirection;
import com.tournament.analytics.domain.model.tournament.AnalysisOptions;
import com.tournament.analytics.domain.model.tournament.AttendancePrediction;
import com.tournament.analytics.domain.model.tournament.FormatPopularity;
import com.tournament.analytics.domain.model.tournament.MetricComparison;
import com.tournament.analytics.domain.model.tournament.PerformanceComparison;
import com.tournament.analytics.domain.model.tournament.PerformanceMetrics;
import com.tournament.analytics.domain.model.tournament.PlayerEngagement;
import com.tournament.analytics.domain.model.tournament.TournamentBenchmarks;
import com.tournament.analytics.domain.model.tournament.TournamentMetrics;
import com.tournament.analytics.domain.model.tournament.TournamentPerformance;
import com.tournament.analytics.domain.model.tournament.TournamentTrend;
import com.tournament.analytics.domain.service.Statistics;
import com.tournament.analytics.infrastructure.persistence.entity.PaymentEntity.PaymentStatus;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentPlayerEntity;
import com.tournament.analytics.infrastructure.persistence.repository.PaymentRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentPlayerRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tournament performance, format popularity, attendance prediction, engagement and
 * benchmarks. Period metrics come from tournament aggregates; per-tournament detail
 * (formats, players, payments) is read from the raw store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TournamentAnalyzer {

    static final double TARGET_COMPLETION_RATE = 85;
    static final double TARGET_AVG_PLAYERS = 16;
    static final double TARGET_AVG_DURATION = 180;
    static final double TARGET_PLAYER_RETENTION = 60;
    private static final double BENCHMARK_TOLERANCE = 5;
    private static final double TREND_DEAD_BAND = 1;

    private static final double WEIGHT_HISTORICAL = 0.3;
    private static final double WEIGHT_FORMAT = 0.3;
    private static final double WEIGHT_DAY_OF_WEEK = 0.25;
    private static final double WEIGHT_SEASONAL = 0.15;

    private static final int TOP_PLAYERS = 10;

    private final TournamentAggregateRepository tournamentAggregateRepository;
    private final TournamentRepository tournamentRepository;
    private final TournamentPlayerRepository tournamentPlayerRepository;
    private final PaymentRepository paymentRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public TournamentPerformance analyzeTournamentPerformance(String tenantId, AnalysisOptions options) {
        PeriodType periodType = options.getPeriodType() != null ? options.getPeriodType() : PeriodType.MONTH;
        if (periodType != PeriodType.DAY && periodType != PeriodType.WEEK && periodType != PeriodType.MONTH) {
            throw new AnalyticsValidationException("Tournament performance supports day, week or month periods, got "
                    + periodType);
        }

        LocalDate endDate = options.getEndDate() != null ? options.getEndDate() : LocalDate.now(clock);
        LocalDate periodStart = periodType.startOf(endDate);
        LocalDate periodEnd = periodType.endOf(endDate);
        LocalDate windowStart = options.getStartDate() != null ? options.getStartDate() : periodStart;

        PerformanceMetrics metrics = summarize(tournamentAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                        tenantId, periodType, windowStart, periodEnd));

        PerformanceComparison comparison = null;
        if (options.isCompareToPrevious()) {
            LocalDate previousStart = periodType.previous(periodStart);
            PerformanceMetrics previous = summarize(tournamentAggregateRepository
                    .findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                            tenantId, periodType, previousStart, periodType.endOf(previousStart)));
            comparison = compare(metrics, previous);
        }

        List<FormatPopularity> formats = null;
        if (options.isIncludeFormatBreakdown()) {
            formats = analyzeFormatPopularity(tenantId, windowStart, periodEnd);
        }

        return TournamentPerformance.builder()
                .periodStart(windowStart)
                .periodEnd(periodEnd)
                .periodType(periodType)
                .metrics(metrics)
                .comparison(comparison)
                .formatBreakdown(formats)
                .insights(generateInsights(metrics, comparison, formats))
                .build();
    }

    /**
     * Per-format metrics for tournaments created between the two dates (inclusive),
     * most popular first.
     */
    @Transactional(readOnly = true)
    public List<FormatPopularity> analyzeFormatPopularity(String tenantId, LocalDate from, LocalDate to) {
        List<TournamentEntity> tournaments = tournamentRepository.findCreatedBetween(
                tenantId, startOfDay(from), startOfDay(to.plusDays(1)));
        if (tournaments.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> ids = tournaments.stream().map(TournamentEntity::getId).toList();
        Map<String, Long> players = playerCounts(ids);
        Map<String, Long> revenueCents = new HashMap<>();
        for (Object[] row : paymentRepository.sumAmountByTournament(tenantId, PaymentStatus.SUCCEEDED, ids)) {
            revenueCents.put((String) row[0], ((Number) row[1]).longValue());
        }

        Map<String, List<TournamentEntity>> byFormat = new LinkedHashMap<>();
        for (TournamentEntity tournament : tournaments) {
            byFormat.computeIfAbsent(tournament.getFormat(), f -> new ArrayList<>()).add(tournament);
        }

        List<FormatPopularity> results = new ArrayList<>();
        for (Map.Entry<String, List<TournamentEntity>> entry : byFormat.entrySet()) {
            List<TournamentEntity> group = entry.getValue();
            int count = group.size();
            int totalPlayers = 0;
            long cents = 0;
            for (TournamentEntity tournament : group) {
                totalPlayers += players.getOrDefault(tournament.getId(), 0L).intValue();
                cents += revenueCents.getOrDefault(tournament.getId(), 0L);
            }
            long completed = group.stream().filter(TournamentEntity::isCompleted).count();
            BigDecimal revenue = MoneyUtils.fromCents(cents);

            results.add(FormatPopularity.builder()
                    .format(entry.getKey())
                    .tournamentCount(count)
                    .totalPlayers(totalPlayers)
                    .avgPlayersPerTournament(MoneyUtils.round2(totalPlayers / (double) count))
                    .completionRate(MoneyUtils.percentage(completed, count))
                    .avgDurationMinutes(MoneyUtils.round2(averageCompletedDuration(group)))
                    .totalRevenue(revenue)
                    .avgRevenuePerTournament(MoneyUtils.divide(revenue, count))
                    .marketShare(MoneyUtils.percentage(count, tournaments.size()))
                    .build());
        }

        results.sort(Comparator.comparingInt(FormatPopularity::getTournamentCount).reversed());
        return results;
    }

    /**
     * The last {@code periods} buckets of {@code periodType}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TournamentTrend> analyzeTournamentTrends(String tenantId, PeriodType periodType, int periods) {
        if (periods < 1) {
            throw new AnalyticsValidationException("Number of periods must be positive, got " + periods);
        }
        LocalDate current = periodType.startOf(LocalDate.now(clock));
        LocalDate first = current;
        for (int i = 1; i < periods; i++) {
            first = periodType.previous(first);
        }

        Map<LocalDate, TournamentAggregateEntity> byStart = new HashMap<>();
        for (TournamentAggregateEntity aggregate : tournamentAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                        tenantId, periodType, first, current)) {
            byStart.put(aggregate.getPeriodStart(), aggregate);
        }

        List<TournamentTrend> trends = new ArrayList<>();
        PerformanceMetrics previous = null;
        LocalDate start = first;
        for (int i = 0; i < periods; i++) {
            TournamentAggregateEntity aggregate = byStart.get(start);
            PerformanceMetrics metrics = summarize(aggregate == null
                    ? Collections.emptyList()
                    : Collections.singletonList(aggregate));

            TournamentTrend.TournamentTrendBuilder trend = TournamentTrend.builder()
                    .periodStart(start)
                    .tournamentCount(metrics.getTournamentCount())
                    .completionRate(metrics.getCompletionRate())
                    .avgPlayers(metrics.getAvgPlayersPerTournament())
                    .totalRevenue(metrics.getTotalRevenue());

            if (previous != null) {
                trend.tournamentGrowth(growth(metrics.getTournamentCount(), previous.getTournamentCount()))
                        .playerGrowth(growth(metrics.getAvgPlayersPerTournament(),
                                previous.getAvgPlayersPerTournament()))
                        .revenueGrowth(growth(metrics.getTotalRevenue().doubleValue(),
                                previous.getTotalRevenue().doubleValue()));
            }
            trends.add(trend.build());
            previous = metrics;
            start = periodType.next(start);
        }
        return trends;
    }

    /**
     * Participation, completion, duration and player return over all of a tenant's
     * tournaments, or a single one when {@code tournamentId} is given.
     */
    @Transactional(readOnly = true)
    public TournamentMetrics calculateTournamentMetrics(String tenantId, String tournamentId) {
        List<TournamentEntity> tournaments;
        if (tournamentId != null) {
            TournamentEntity tournament = tournamentRepository.findByIdAndOrgId(tournamentId, tenantId)
                    .orElseThrow(() -> new NotFoundException("Tournament " + tournamentId
                            + " not found for tenant " + tenantId));
            tournaments = Collections.singletonList(tournament);
        } else {
            tournaments = tournamentRepository.findByOrgId(tenantId);
        }

        if (tournaments.isEmpty()) {
            return TournamentMetrics.builder().build();
        }

        List<TournamentPlayerEntity> registrations = tournamentPlayerRepository.findByTournamentIdIn(
                tournaments.stream().map(TournamentEntity::getId).toList());

        long played = registrations.stream().filter(TournamentPlayerEntity::hasPlayed).count();
        long completed = tournaments.stream().filter(TournamentEntity::isCompleted).count();

        Map<String, Integer> participations = new HashMap<>();
        for (TournamentPlayerEntity registration : registrations) {
            participations.merge(registration.getPlayerId(), 1, Integer::sum);
        }
        long repeatPlayers = participations.values().stream().filter(count -> count > 1).count();

        return TournamentMetrics.builder()
                .tournamentCount(tournaments.size())
                .participationRate(MoneyUtils.percentage(played, registrations.size()))
                .completionRate(MoneyUtils.percentage(completed, tournaments.size()))
                .avgDurationMinutes(MoneyUtils.round2(averageCompletedDuration(tournaments)))
                .avgPlayersPerTournament(MoneyUtils.round2(registrations.size() / (double) tournaments.size()))
                .playerReturnRate(MoneyUtils.percentage(repeatPlayers, participations.size()))
                .build();
    }

    /**
     * Weighted blend of the six-month same-format average (0.3), the three-month format
     * average (0.3), the same-weekday average (0.25) and the same-month average (0.15).
     */
    @Transactional(readOnly = true)
    public AttendancePrediction predictTournamentAttendance(String tenantId, String format, LocalDate date) {
        List<TournamentEntity> history = tournamentRepository.findByOrgIdAndFormatAndCreatedAtGreaterThanEqual(
                tenantId, format, startOfDay(date.minusMonths(6)));
        Map<String, Long> players = history.isEmpty()
                ? Collections.emptyMap()
                : playerCounts(history.stream().map(TournamentEntity::getId).toList());

        ZoneId zone = clock.getZone();
        List<Double> all = new ArrayList<>();
        List<Double> sameDay = new ArrayList<>();
        List<Double> sameMonth = new ArrayList<>();
        for (TournamentEntity tournament : history) {
            double count = players.getOrDefault(tournament.getId(), 0L);
            LocalDate created = tournament.getCreatedAt().atZone(zone).toLocalDate();
            all.add(count);
            if (created.getDayOfWeek() == date.getDayOfWeek()) {
                sameDay.add(count);
            }
            if (created.getMonth() == date.getMonth()) {
                sameMonth.add(count);
            }
        }

        double historicalAverage = Statistics.mean(all);
        double dayOfWeekAverage = sameDay.isEmpty() ? historicalAverage : Statistics.mean(sameDay);
        double monthlyAverage = sameMonth.isEmpty() ? historicalAverage : Statistics.mean(sameMonth);
        double formatPopularity = analyzeFormatPopularity(tenantId, date.minusMonths(3), date).stream()
                .filter(f -> format.equals(f.getFormat()))
                .map(FormatPopularity::getAvgPlayersPerTournament)
                .findFirst()
                .orElse(historicalAverage);

        double predicted = historicalAverage * WEIGHT_HISTORICAL
                + formatPopularity * WEIGHT_FORMAT
                + dayOfWeekAverage * WEIGHT_DAY_OF_WEEK
                + monthlyAverage * WEIGHT_SEASONAL;

        Confidence confidence;
        double width;
        if (history.size() >= 10) {
            confidence = Confidence.HIGH;
            width = 0.15;
        } else if (history.size() >= 5) {
            confidence = Confidence.MEDIUM;
            width = 0.25;
        } else {
            confidence = Confidence.LOW;
            width = 0.4;
        }

        String recommendation;
        if (predicted > historicalAverage * 1.2) {
            recommendation = "High attendance expected. Consider adding extra tables or staff.";
        } else if (predicted < historicalAverage * 0.8) {
            recommendation = "Lower attendance expected. Good opportunity for promotions or marketing.";
        } else {
            recommendation = "Average attendance expected. Prepare for a typical tournament setup.";
        }

        return AttendancePrediction.builder()
                .format(format)
                .date(date)
                .dayOfWeek(date.getDayOfWeek())
                .predictedAttendance(Math.round(predicted))
                .low(Math.max(0, Math.round(predicted * (1 - width))))
                .high(Math.round(predicted * (1 + width)))
                .confidence(confidence)
                .historicalTournaments(history.size())
                .historicalAverage(MoneyUtils.round2(historicalAverage))
                .formatPopularity(MoneyUtils.round2(formatPopularity))
                .dayOfWeekTrend(historicalAverage > 0 ? MoneyUtils.percentage(dayOfWeekAverage, historicalAverage) : 100)
                .seasonalFactor(historicalAverage > 0 ? MoneyUtils.percentage(monthlyAverage, historicalAverage) : 100)
                .recommendation(recommendation)
                .build();
    }

    @Transactional(readOnly = true)
    public PlayerEngagement analyzePlayerEngagement(String tenantId, LocalDate from, LocalDate to) {
        List<TournamentEntity> tournaments = tournamentRepository.findCreatedBetween(
                tenantId, startOfDay(from), startOfDay(to.plusDays(1)));
        List<TournamentPlayerEntity> registrations = tournaments.isEmpty()
                ? Collections.emptyList()
                : tournamentPlayerRepository.findByTournamentIdIn(
                        tournaments.stream().map(TournamentEntity::getId).toList());

        Map<String, Integer> participations = new LinkedHashMap<>();
        Map<String, String> names = new HashMap<>();
        for (TournamentPlayerEntity registration : registrations) {
            participations.merge(registration.getPlayerId(), 1, Integer::sum);
            if (registration.getPlayerName() != null) {
                names.put(registration.getPlayerId(), registration.getPlayerName());
            }
        }

        PlayerEngagement.Segments segments = new PlayerEngagement.Segments();
        int repeat = 0;
        for (int count : participations.values()) {
            if (count == 1) {
                segments.setOneTournament(segments.getOneTournament() + 1);
            } else if (count <= 5) {
                segments.setTwoToFive(segments.getTwoToFive() + 1);
            } else if (count <= 10) {
                segments.setSixToTen(segments.getSixToTen() + 1);
            } else {
                segments.setMoreThanTen(segments.getMoreThanTen() + 1);
            }
            if (count > 1) {
                repeat++;
            }
        }

        List<PlayerEngagement.TopPlayer> topPlayers = participations.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_PLAYERS)
                .map(entry -> PlayerEngagement.TopPlayer.builder()
                        .playerId(entry.getKey())
                        .playerName(names.getOrDefault(entry.getKey(), "Unknown"))
                        .tournamentCount(entry.getValue())
                        .build())
                .toList();

        int unique = participations.size();
        double newPlayerRate = MoneyUtils.percentage(segments.getOneTournament(), unique);

        return PlayerEngagement.builder()
                .from(from)
                .to(to)
                .uniquePlayers(unique)
                .totalParticipations(registrations.size())
                .avgTournamentsPerPlayer(unique > 0 ? MoneyUtils.round2(registrations.size() / (double) unique) : 0)
                .repeatParticipationRate(MoneyUtils.percentage(repeat, unique))
                .newPlayerRate(newPlayerRate)
                .retentionRate(unique > 0 ? MoneyUtils.round2(100 - newPlayerRate) : 0)
                .segments(segments)
                .topPlayers(topPlayers)
                .build();
    }

    @Transactional(readOnly = true)
    public TournamentBenchmarks getTournamentBenchmarks(String tenantId) {
        TournamentMetrics metrics = calculateTournamentMetrics(tenantId, null);

        TournamentBenchmarks.Benchmark completion = benchmark(metrics.getCompletionRate(), TARGET_COMPLETION_RATE);
        TournamentBenchmarks.Benchmark players = benchmark(metrics.getAvgPlayersPerTournament(), TARGET_AVG_PLAYERS);
        TournamentBenchmarks.Benchmark duration = benchmark(metrics.getAvgDurationMinutes(), TARGET_AVG_DURATION);
        TournamentBenchmarks.Benchmark retention = benchmark(metrics.getPlayerReturnRate(), TARGET_PLAYER_RETENTION);

        List<String> recommendations = new ArrayList<>();
        List<String> strengths = new ArrayList<>();
        List<String> improvements = new ArrayList<>();

        if (completion.getStatus() == BenchmarkStatus.BELOW) {
            recommendations.add("Improve tournament completion rates through better time management and player communication");
            improvements.add("Tournament completion rate");
        } else if (completion.getStatus() == BenchmarkStatus.ABOVE) {
            strengths.add("Excellent tournament completion rate");
        }

        if (players.getStatus() == BenchmarkStatus.BELOW) {
            recommendations.add("Increase tournament participation through marketing and player outreach");
            improvements.add("Player attendance");
        } else if (players.getStatus() == BenchmarkStatus.ABOVE) {
            strengths.add("Strong player turnout per tournament");
        }

        // longer than target is the weak side for duration
        if (duration.getStatus() == BenchmarkStatus.ABOVE) {
            recommendations.add("Consider optimizing the tournament format or adding tables to reduce duration");
            improvements.add("Tournament duration");
        } else if (duration.getStatus() == BenchmarkStatus.BELOW) {
            strengths.add("Efficient tournament pacing and timing");
        }

        if (retention.getStatus() == BenchmarkStatus.BELOW) {
            recommendations.add("Introduce player engagement programs to improve repeat participation");
            improvements.add("Player retention");
        } else if (retention.getStatus() == BenchmarkStatus.ABOVE) {
            strengths.add("High player retention and loyalty");
        }

        return TournamentBenchmarks.builder()
                .tenantId(tenantId)
                .industry("Pool Tournaments")
                .completionRate(completion)
                .avgPlayers(players)
                .avgDuration(duration)
                .playerRetention(retention)
                .recommendations(recommendations)
                .strengths(strengths)
                .improvementAreas(improvements)
                .build();
    }

    static int percentile(double current, double target) {
        if (current >= target * 1.2) {
            return 90;
        }
        if (current >= target * 1.1) {
            return 75;
        }
        if (current >= target) {
            return 60;
        }
        if (current >= target * 0.9) {
            return 40;
        }
        if (current >= target * 0.8) {
            return 25;
        }
        return 10;
    }

    /**
     * Trend of {@code current} against {@code previous}; flat inside ±1% and when there
     * is no previous value.
     */
    static TrendDirection trend(double current, double previous) {
        double change = previous > 0 ? (current - previous) / previous * 100.0 : 0.0;
        return TrendDirection.of(change, TREND_DEAD_BAND);
    }

    static PerformanceMetrics summarize(List<TournamentAggregateEntity> aggregates) {
        int tournaments = 0;
        int completed = 0;
        int players = 0;
        double weightedDuration = 0;
        BigDecimal revenue = BigDecimal.ZERO;

        for (TournamentAggregateEntity aggregate : aggregates) {
            tournaments += aggregate.getTournamentCount();
            completed += aggregate.getCompletedCount();
            players += aggregate.getTotalPlayers();
            weightedDuration += MoneyUtils.toDouble(aggregate.getAvgDurationMinutes()) * aggregate.getTournamentCount();
            revenue = revenue.add(MoneyUtils.orZero(aggregate.getRevenue()));
        }

        return PerformanceMetrics.builder()
                .tournamentCount(tournaments)
                .completedCount(completed)
                .completionRate(MoneyUtils.percentage(completed, tournaments))
                .avgPlayersPerTournament(tournaments > 0 ? MoneyUtils.round2(players / (double) tournaments) : 0)
                .avgDurationMinutes(tournaments > 0 ? MoneyUtils.round2(weightedDuration / tournaments) : 0)
                .totalPlayers(players)
                .totalRevenue(MoneyUtils.scale(revenue))
                .avgRevenuePerTournament(MoneyUtils.divide(revenue, tournaments))
                .build();
    }

    private static PerformanceComparison compare(PerformanceMetrics current, PerformanceMetrics previous) {
        return PerformanceComparison.builder()
                .tournamentCount(comparison(current.getTournamentCount(), previous.getTournamentCount()))
                .completionRate(comparison(current.getCompletionRate(), previous.getCompletionRate()))
                .avgPlayers(comparison(current.getAvgPlayersPerTournament(), previous.getAvgPlayersPerTournament()))
                .revenue(comparison(current.getTotalRevenue().doubleValue(), previous.getTotalRevenue().doubleValue()))
                .build();
    }

    private static MetricComparison comparison(double current, double previous) {
        return MetricComparison.builder()
                .previousValue(previous)
                .change(MoneyUtils.round2(current - previous))
                .trend(trend(current, previous))
                .build();
    }

    private static List<String> generateInsights(PerformanceMetrics metrics, PerformanceComparison comparison,
                                                 List<FormatPopularity> formats) {
        List<String> insights = new ArrayList<>();

        if (metrics.getTournamentCount() > 0 && metrics.getCompletionRate() < 70) {
            insights.add(String.format(Locale.ROOT,
                    "Low completion rate (%s%%). Consider investigating causes of tournament cancellations.",
                    metrics.getCompletionRate()));
        } else if (metrics.getCompletionRate() > 90) {
            insights.add(String.format(Locale.ROOT,
                    "Excellent completion rate (%s%%). Your tournaments are running smoothly.",
                    metrics.getCompletionRate()));
        }

        if (comparison != null) {
            MetricComparison count = comparison.getTournamentCount();
            if (count.getTrend() == TrendDirection.UP && count.getChange() > 0) {
                insights.add(String.format(Locale.ROOT,
                        "Tournament count increased by %d compared to the previous period.",
                        Math.round(count.getChange())));
            }
            MetricComparison revenue = comparison.getRevenue();
            if (revenue.getTrend() == TrendDirection.UP && revenue.getChange() > 0) {
                insights.add(String.format(Locale.ROOT, "Revenue increased by $%d compared to the previous period.",
                        Math.round(revenue.getChange())));
            }
        }

        if (formats != null && !formats.isEmpty()) {
            FormatPopularity top = formats.get(0);
            insights.add(String.format(Locale.ROOT, "%s is your most popular format with %s%% market share.",
                    top.getFormat(), top.getMarketShare()));

            FormatPopularity highestRevenue = Collections.max(formats,
                    Comparator.comparing(FormatPopularity::getTotalRevenue));
            if (!highestRevenue.getFormat().equals(top.getFormat())
                    && highestRevenue.getTotalRevenue().compareTo(top.getTotalRevenue()) > 0) {
                insights.add(String.format(Locale.ROOT,
                        "%s generates the highest revenue despite not being the most popular format.",
                        highestRevenue.getFormat()));
            }
        }
        return insights;
    }

    private static TournamentBenchmarks.Benchmark benchmark(double current, double target) {
        return TournamentBenchmarks.Benchmark.builder()
                .target(target)
                .current(current)
                .status(BenchmarkStatus.compare(current, target, BENCHMARK_TOLERANCE))
                .percentile(percentile(current, target))
                .build();
    }

    private static double growth(double current, double previous) {
        return MoneyUtils.round2(Statistics.percentChange(current, previous));
    }

    private static double averageCompletedDuration(List<TournamentEntity> tournaments) {
        return tournaments.stream()
                .filter(TournamentEntity::isCompleted)
                .map(TournamentEntity::getDurationMinutes)
                .filter(duration -> duration != null)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
    }

    private Map<String, Long> playerCounts(List<String> tournamentIds) {
        Map<String, Long> counts = new HashMap<>();
        for (Object[] row : tournamentPlayerRepository.countByTournamentIds(tournamentIds)) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(clock.getZone()).toInstant();
    }
}
