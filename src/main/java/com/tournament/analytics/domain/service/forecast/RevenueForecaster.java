package com.tournament.analytics.domain.service.forecast;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.ConfidenceInterval;
import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.forecast.RevenueForecast;
import com.tournament.analytics.domain.model.forecast.Trendline;
import com.tournament.analytics.domain.model.forecast.UserGrowthForecast;
import com.tournament.analytics.domain.service.Statistics;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import com.tournament.analytics.infrastructure.persistence.repository.RevenueAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Closed-form forecasting over aggregated history: a least-squares trend with
 * multiplicative monthly seasonality for revenue, and a growth/churn model for users.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevenueForecaster {

    static final int HISTORY_MONTHS = 12;
    private static final int MIN_POINTS = 3;
    private static final double MIN_USER_GROWTH = 0.05;
    private static final double DEFAULT_CHURN_RATE = 20.0;
    private static final double USER_BAND = 0.2;

    private final RevenueAggregateRepository revenueAggregateRepository;
    private final UserCohortRepository userCohortRepository;
    private final Clock clock;

    public Trendline calculateTrendline(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            throw new InsufficientDataException("trendline", 2, n);
        }

        double xMean = (n - 1) / 2.0;
        double yMean = Statistics.mean(values);

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (values.get(i) - yMean);
            denominator += (i - xMean) * (i - xMean);
        }
        double slope = denominator != 0 ? numerator / denominator : 0.0;
        double intercept = yMean - slope * xMean;

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double predicted = slope * i + intercept;
            ssRes += Math.pow(values.get(i) - predicted, 2);
            ssTot += Math.pow(values.get(i) - yMean, 2);
        }
        double rSquared = ssTot != 0 ? 1 - ssRes / ssTot : 0.0;

        return Trendline.builder()
                .slope(slope)
                .intercept(intercept)
                .rSquared(Math.max(0.0, Math.min(1.0, rSquared)))
                .equation(String.format(Locale.ROOT, "y = %.2fx + %.2f", slope, intercept))
                .build();
    }

    /**
     * Average of each calendar month divided by the overall average. Returns an empty map
     * for fewer than 12 points, which callers treat as "no seasonal effect".
     */
    public Map<Month, Double> detectSeasonality(Map<YearMonth, Double> series) {
        if (series.size() < HISTORY_MONTHS) {
            log.debug("Not enough data for seasonality detection ({} points)", series.size());
            return new EnumMap<>(Month.class);
        }

        Map<Month, List<Double>> byMonth = new EnumMap<>(Month.class);
        for (Map.Entry<YearMonth, Double> point : series.entrySet()) {
            byMonth.computeIfAbsent(point.getKey().getMonth(), m -> new ArrayList<>()).add(point.getValue());
        }

        double overall = Statistics.mean(new ArrayList<>(series.values()));
        Map<Month, Double> factors = new EnumMap<>(Month.class);
        byMonth.forEach((month, values) ->
                factors.put(month, overall > 0 ? Statistics.mean(values) / overall : 1.0));
        return factors;
    }

    public ConfidenceInterval calculateConfidenceInterval(double prediction, List<Double> history, double level) {
        double z = level >= 0.95 ? 1.96 : 1.645;
        double standardError = history.isEmpty()
                ? 0.0
                : Statistics.populationStdDev(history) / Math.sqrt(history.size());
        double margin = z * standardError;
        return ConfidenceInterval.builder()
                .lower(prediction - margin)
                .upper(prediction + margin)
                .level(level)
                .build();
    }

    @Transactional(readOnly = true)
    public RevenueForecast predictRevenue(String tenantId, int months) {
        AnalyticsValidationException.requireHorizon(months);

        YearMonth current = YearMonth.now(clock);
        YearMonth first = current.minusMonths(HISTORY_MONTHS - 1);

        Map<YearMonth, BigDecimal> mrrByMonth = new HashMap<>();
        for (RevenueAggregateEntity aggregate : revenueAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                        tenantId, PeriodType.MONTH, first.atDay(1), current.atDay(1))) {
            mrrByMonth.put(YearMonth.from(aggregate.getPeriodStart()), MoneyUtils.orZero(aggregate.getMrr()));
        }

        Map<YearMonth, Double> series = new LinkedHashMap<>();
        for (int i = 0; i < HISTORY_MONTHS; i++) {
            YearMonth month = first.plusMonths(i);
            series.put(month, MoneyUtils.toDouble(mrrByMonth.get(month)));
        }
        List<Double> values = new ArrayList<>(series.values());

        int nonZero = (int) values.stream().filter(v -> v > 0).count();
        if (nonZero < MIN_POINTS) {
            throw new InsufficientDataException("revenue forecast", MIN_POINTS, nonZero);
        }

        Trendline trendline = calculateTrendline(values);
        Map<Month, Double> seasonality = detectSeasonality(series);
        Confidence confidence = trendline.getRSquared() >= 0.8 ? Confidence.HIGH
                : trendline.getRSquared() >= 0.6 ? Confidence.MEDIUM : Confidence.LOW;

        List<RevenueForecast.RevenuePrediction> predictions = new ArrayList<>();
        for (int i = 1; i <= months; i++) {
            YearMonth target = current.plusMonths(i);
            double factor = seasonality.getOrDefault(target.getMonth(), 1.0);
            double predicted = Math.max(0.0, trendline.valueAt(values.size() + i - 1) * factor);
            ConfidenceInterval interval = calculateConfidenceInterval(predicted, values, 0.95);

            predictions.add(RevenueForecast.RevenuePrediction.builder()
                    .month(target)
                    .predictedMrr(MoneyUtils.scale(BigDecimal.valueOf(predicted)))
                    .low(MoneyUtils.scale(BigDecimal.valueOf(Math.max(0.0, interval.getLower()))))
                    .high(MoneyUtils.scale(BigDecimal.valueOf(interval.getUpper())))
                    .seasonalFactor(MoneyUtils.round2(factor))
                    .build());
        }

        log.info("Revenue forecast for tenant {}: {} months, R²={}", tenantId, months,
                String.format(Locale.ROOT, "%.2f", trendline.getRSquared()));

        return RevenueForecast.builder()
                .tenantId(tenantId)
                .predictions(predictions)
                .trendline(trendline)
                .historicalMonths(values.size())
                .nonZeroMonths(nonZero)
                .seasonalityApplied(!seasonality.isEmpty())
                .confidence(confidence)
                .accuracy((int) Math.round(trendline.getRSquared() * 100))
                .build();
    }

    /**
     * Projects cohort sign-ups forward. New users grow at the historical average rate
     * (at least 5% a month); churn is 100 minus the average month-1 retention of the
     * same cohorts, or 20% when no cohort has reached month 1.
     */
    @Transactional(readOnly = true)
    public UserGrowthForecast predictUserGrowth(String tenantId, int months) {
        AnalyticsValidationException.requireHorizon(months);

        YearMonth current = YearMonth.now(clock);
        LocalDate from = current.minusMonths(HISTORY_MONTHS - 1).atDay(1);
        LocalDate to = current.atDay(1);

        List<UserCohortEntity> signups = withinRange(
                userCohortRepository.findByTenantIdAndMonthNumberOrderByCohortMonthAsc(tenantId, 0), from, to);
        if (signups.size() < MIN_POINTS) {
            throw new InsufficientDataException("user growth forecast", MIN_POINTS, signups.size());
        }

        List<Double> growthRates = new ArrayList<>();
        for (int i = 1; i < signups.size(); i++) {
            int previous = signups.get(i - 1).getCohortSize();
            if (previous > 0) {
                growthRates.add((signups.get(i).getCohortSize() - previous) / (double) previous);
            }
        }
        double avgGrowthRate = Statistics.mean(growthRates);

        List<Double> churnRates = new ArrayList<>();
        for (UserCohortEntity row : withinRange(
                userCohortRepository.findByTenantIdAndMonthNumberOrderByCohortMonthAsc(tenantId, 1), from, to)) {
            if (row.getCohortSize() > 0 && row.getRetentionRate() != null) {
                churnRates.add(100.0 - row.getRetentionRate().doubleValue());
            }
        }
        boolean churnMeasured = !churnRates.isEmpty();
        double avgChurnRate = churnMeasured ? Statistics.mean(churnRates) : DEFAULT_CHURN_RATE;

        double stdDev = Statistics.populationStdDev(growthRates);
        Confidence confidence = stdDev < 0.1 ? Confidence.HIGH : stdDev < 0.2 ? Confidence.MEDIUM : Confidence.LOW;

        long users = signups.get(signups.size() - 1).getCohortSize();
        List<UserGrowthForecast.UserGrowthPrediction> predictions = new ArrayList<>();
        for (int i = 1; i <= months; i++) {
            long newUsers = Math.round(users * Math.max(avgGrowthRate, MIN_USER_GROWTH));
            long churnedUsers = Math.round(users * (avgChurnRate / 100.0));
            users = Math.max(0, users + newUsers - churnedUsers);

            predictions.add(UserGrowthForecast.UserGrowthPrediction.builder()
                    .month(current.plusMonths(i))
                    .predictedUsers(users)
                    .predictedActive(Math.round(users * (1 - avgChurnRate / 100.0)))
                    .newUsers(newUsers)
                    .churnedUsers(churnedUsers)
                    .low(Math.round(users * (1 - USER_BAND)))
                    .high(Math.round(users * (1 + USER_BAND)))
                    .build());
        }

        return UserGrowthForecast.builder()
                .tenantId(tenantId)
                .predictions(predictions)
                .avgGrowthRate(MoneyUtils.round2(avgGrowthRate * 100))
                .avgChurnRate(MoneyUtils.round2(avgChurnRate))
                .churnMeasured(churnMeasured)
                .historicalMonths(signups.size())
                .confidence(confidence)
                .build();
    }

    private static List<UserCohortEntity> withinRange(List<UserCohortEntity> rows, LocalDate from, LocalDate to) {
        List<UserCohortEntity> result = new ArrayList<>();
        for (UserCohortEntity row : rows) {
            if (!row.getCohortMonth().isBefore(from) && !row.getCohortMonth().isAfter(to)) {
                result.add(row);
            }
        }
        return result;
    }
}
