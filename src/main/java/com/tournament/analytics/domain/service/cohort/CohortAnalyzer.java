package com.tournament.analytics.domain.service.cohort;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.BenchmarkStatus;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.cohort.CohortAnalysis;
import com.tournament.analytics.domain.model.cohort.CohortComparison;
import com.tournament.analytics.domain.model.cohort.CohortLtv;
import com.tournament.analytics.domain.model.cohort.CohortMaturity;
import com.tournament.analytics.domain.model.cohort.RetentionBenchmarks;
import com.tournament.analytics.domain.model.cohort.RetentionPoint;
import com.tournament.analytics.domain.model.cohort.RetentionPrediction;
import com.tournament.analytics.domain.model.cohort.RetentionTrend;
import com.tournament.analytics.domain.service.Statistics;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retention and lifetime-value analysis over aggregated cohort rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CohortAnalyzer {

    static final Map<Integer, Double> RETENTION_TARGETS = new LinkedHashMap<>();

    static {
        RETENTION_TARGETS.put(1, 40.0);
        RETENTION_TARGETS.put(3, 25.0);
        RETENTION_TARGETS.put(6, 20.0);
        RETENTION_TARGETS.put(12, 15.0);
    }

    private static final double BENCHMARK_TOLERANCE = 2.0;
    private static final double DEFAULT_DECAY_RATE = 0.1;

    private final UserCohortRepository userCohortRepository;

    @Transactional(readOnly = true)
    public CohortAnalysis analyzeCohort(String tenantId, LocalDate cohortMonth) {
        LocalDate cohortStart = cohortMonth.withDayOfMonth(1);
        List<UserCohortEntity> rows = loadCohort(tenantId, cohortStart);

        int cohortSize = rows.get(0).getCohortSize();
        List<RetentionPoint> curve = new ArrayList<>();
        for (UserCohortEntity row : rows) {
            int month = row.getMonthNumber();
            int churned = month == 0 ? 0 : cohortSize - row.getRetainedUsers();
            curve.add(RetentionPoint.builder()
                    .monthNumber(month)
                    .date(cohortStart.plusMonths(month))
                    .retainedUsers(row.getRetainedUsers())
                    .retentionRate(MoneyUtils.toDouble(row.getRetentionRate()))
                    .churnedUsers(churned)
                    .churnRate(month == 0 ? 0.0 : MoneyUtils.percentage(churned, cohortSize))
                    .build());
        }

        double avgRetention = curve.stream().mapToDouble(RetentionPoint::getRetentionRate).average().orElse(0.0);

        BigDecimal totalRevenue = rows.stream()
                .map(row -> MoneyUtils.orZero(row.getRevenue()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal avgRevenuePerUser = MoneyUtils.divide(totalRevenue, cohortSize);
        BigDecimal latestLtv = rows.get(rows.size() - 1).getLifetimeValue();

        return CohortAnalysis.builder()
                .tenantId(tenantId)
                .cohortMonth(cohortStart)
                .cohortSize(cohortSize)
                .retentionCurve(curve)
                .avgRetentionRate(MoneyUtils.round2(avgRetention))
                .month1Retention(checkpoint(curve, 1))
                .month3Retention(checkpoint(curve, 3))
                .month6Retention(checkpoint(curve, 6))
                .month12Retention(checkpoint(curve, 12))
                .totalRevenue(MoneyUtils.scale(totalRevenue))
                .avgRevenuePerUser(avgRevenuePerUser)
                .ltv(latestLtv != null ? MoneyUtils.scale(latestLtv) : avgRevenuePerUser)
                .maturity(CohortMaturity.fromMonthsOfData(rows.size()))
                .build();
    }

    @Transactional(readOnly = true)
    public List<RetentionPoint> calculateRetentionCurve(String tenantId, LocalDate cohortMonth) {
        return analyzeCohort(tenantId, cohortMonth).getRetentionCurve();
    }

    /**
     * Cumulative revenue per member, projected forward by a fixed factor: 1.5 while the
     * latest retention is above 20%, 1.2 otherwise.
     */
    @Transactional(readOnly = true)
    public CohortLtv calculateCohortLtv(String tenantId, LocalDate cohortMonth) {
        LocalDate cohortStart = cohortMonth.withDayOfMonth(1);
        List<UserCohortEntity> rows = loadCohort(tenantId, cohortStart);
        int cohortSize = rows.get(0).getCohortSize();

        BigDecimal cumulative = BigDecimal.ZERO;
        List<CohortLtv.MonthlyRevenue> byMonth = new ArrayList<>();
        for (UserCohortEntity row : rows) {
            BigDecimal revenue = MoneyUtils.orZero(row.getRevenue());
            cumulative = cumulative.add(revenue);
            byMonth.add(CohortLtv.MonthlyRevenue.builder()
                    .monthNumber(row.getMonthNumber())
                    .revenue(MoneyUtils.scale(revenue))
                    .cumulativeRevenue(MoneyUtils.scale(cumulative))
                    .revenuePerUser(MoneyUtils.divide(revenue, cohortSize))
                    .build());
        }

        BigDecimal currentLtv = MoneyUtils.divide(cumulative, cohortSize);
        double lastRetention = MoneyUtils.toDouble(rows.get(rows.size() - 1).getRetentionRate());
        BigDecimal factor = lastRetention > 20 ? new BigDecimal("1.5") : new BigDecimal("1.2");

        int months = rows.size();
        Confidence confidence = months >= 6 ? Confidence.HIGH : months >= 3 ? Confidence.MEDIUM : Confidence.LOW;

        return CohortLtv.builder()
                .cohortMonth(cohortStart)
                .cohortSize(cohortSize)
                .currentLtv(currentLtv)
                .projectedLtv(MoneyUtils.scale(currentLtv.multiply(factor)))
                .revenueByMonth(byMonth)
                .confidence(confidence)
                .build();
    }

    /**
     * Ranks cohorts by month-1 retention. Cohorts that have not reached month 1 rank as 0.
     */
    @Transactional(readOnly = true)
    public CohortComparison compareCohortsRetention(String tenantId, List<LocalDate> cohortMonths) {
        if (cohortMonths.isEmpty()) {
            throw new AnalyticsValidationException("At least one cohort is required for comparison");
        }

        List<CohortComparison.CohortSnapshot> snapshots = new ArrayList<>();
        for (LocalDate cohortMonth : cohortMonths) {
            CohortAnalysis analysis = analyzeCohort(tenantId, cohortMonth);
            snapshots.add(CohortComparison.CohortSnapshot.builder()
                    .cohortMonth(analysis.getCohortMonth())
                    .cohortSize(analysis.getCohortSize())
                    .avgRetention(analysis.getAvgRetentionRate())
                    .month1Retention(analysis.getMonth1Retention())
                    .month3Retention(analysis.getMonth3Retention())
                    .currentLtv(analysis.getLtv())
                    .build());
        }

        List<CohortComparison.CohortSnapshot> ranked = new ArrayList<>(snapshots);
        ranked.sort(Comparator.comparingDouble(CohortAnalyzer::month1OrZero).reversed());

        List<Double> month1Series = snapshots.stream().map(CohortAnalyzer::month1OrZero).toList();

        return CohortComparison.builder()
                .cohorts(snapshots)
                .bestPerformingCohort(ranked.get(0).getCohortMonth())
                .worstPerformingCohort(ranked.get(ranked.size() - 1).getCohortMonth())
                .retentionTrend(RetentionTrend.fromSlope(Statistics.indexSlope(month1Series)))
                .retentionVolatility(MoneyUtils.round2(Statistics.populationStdDev(month1Series)))
                .build();
    }

    /**
     * Exponential-decay projection from the last observed retention rate.
     */
    @Transactional(readOnly = true)
    public RetentionPrediction predictFutureRetention(String tenantId, LocalDate cohortMonth, int months) {
        AnalyticsValidationException.requireHorizon(months);
        CohortAnalysis analysis = analyzeCohort(tenantId, cohortMonth);
        List<RetentionPoint> curve = analysis.getRetentionCurve();

        if (curve.size() < 3) {
            throw new InsufficientDataException("retention prediction", 3, curve.size());
        }

        List<Double> rates = curve.stream().map(RetentionPoint::getRetentionRate).toList();
        double lastRetention = rates.get(rates.size() - 1);
        int lastMonth = curve.get(curve.size() - 1).getMonthNumber();
        double decayRate = calculateDecayRate(rates);

        List<RetentionPrediction.PredictedRetention> predictions = new ArrayList<>();
        for (int i = 1; i <= months; i++) {
            double predicted = lastRetention * Math.exp(-decayRate * i);
            double width = Math.min(10 + i * 2, 30);
            predictions.add(RetentionPrediction.PredictedRetention.builder()
                    .monthNumber(lastMonth + i)
                    .predictedRetention(MoneyUtils.round2(Math.max(0, predicted)))
                    .confidenceWidth(width)
                    .low(MoneyUtils.round2(Math.max(0, predicted - width)))
                    .high(MoneyUtils.round2(Math.min(100, predicted + width)))
                    .build());
        }

        int points = curve.size();
        Confidence confidence = points >= 6 ? Confidence.HIGH : points >= 4 ? Confidence.MEDIUM : Confidence.LOW;

        return RetentionPrediction.builder()
                .cohortMonth(analysis.getCohortMonth())
                .predictions(predictions)
                .decayRate(decayRate)
                .historicalPoints(points)
                .confidence(confidence)
                .build();
    }

    /**
     * Compares the newest cohort against fixed SaaS retention targets.
     */
    @Transactional(readOnly = true)
    public RetentionBenchmarks getRetentionBenchmarks(String tenantId) {
        List<LocalDate> latest = userCohortRepository.findRecentCohortMonths(tenantId, PageRequest.of(0, 1));
        if (latest.isEmpty()) {
            throw new NotFoundException("No cohort data found for tenant " + tenantId);
        }

        CohortAnalysis analysis = analyzeCohort(tenantId, latest.get(0));
        Map<Integer, Double> actuals = new HashMap<>();
        actuals.put(1, analysis.getMonth1Retention());
        actuals.put(3, analysis.getMonth3Retention());
        actuals.put(6, analysis.getMonth6Retention());
        actuals.put(12, analysis.getMonth12Retention());

        List<RetentionBenchmarks.Checkpoint> checkpoints = new ArrayList<>();
        Map<Integer, BenchmarkStatus> statuses = new LinkedHashMap<>();
        for (Map.Entry<Integer, Double> target : RETENTION_TARGETS.entrySet()) {
            Double current = actuals.get(target.getKey());
            BenchmarkStatus status = BenchmarkStatus.compare(current, target.getValue(), BENCHMARK_TOLERANCE);
            statuses.put(target.getKey(), status);
            checkpoints.add(RetentionBenchmarks.Checkpoint.builder()
                    .month(target.getKey())
                    .target(target.getValue())
                    .current(current)
                    .status(status)
                    .build());
        }

        List<String> recommendations = new ArrayList<>();
        if (statuses.get(1) == BenchmarkStatus.BELOW) {
            recommendations.add("Focus on improving onboarding experience to boost month 1 retention");
        }
        if (statuses.get(3) == BenchmarkStatus.BELOW) {
            recommendations.add("Implement engagement campaigns for users at 2-3 months to reduce early churn");
        }
        if (statuses.get(6) == BenchmarkStatus.BELOW) {
            recommendations.add("Introduce loyalty incentives to keep players past their first half-year");
        }
        if (statuses.get(6) == BenchmarkStatus.ABOVE && statuses.get(1) == BenchmarkStatus.ABOVE) {
            recommendations.add("Excellent retention! Consider expanding features for power users");
        }

        return RetentionBenchmarks.builder()
                .tenantId(tenantId)
                .cohortMonth(analysis.getCohortMonth())
                .checkpoints(checkpoints)
                .industry("SaaS")
                .recommendations(recommendations)
                .build();
    }

    /**
     * Newest cohort months first.
     */
    @Transactional(readOnly = true)
    public List<LocalDate> getRecentCohortMonths(String tenantId, int limit) {
        return userCohortRepository.findRecentCohortMonths(tenantId, PageRequest.of(0, limit));
    }

    /**
     * Mean absolute log-ratio between consecutive months. Pairs involving a zero rate are
     * skipped; with no usable pair the default of 0.1 applies.
     */
    static double calculateDecayRate(List<Double> rates) {
        double total = 0;
        int count = 0;
        for (int i = 1; i < rates.size(); i++) {
            double previous = rates.get(i - 1);
            double current = rates.get(i);
            if (previous > 0 && current > 0) {
                total += Math.abs(Math.log(current / previous));
                count++;
            }
        }
        return count > 0 ? total / count : DEFAULT_DECAY_RATE;
    }

    private List<UserCohortEntity> loadCohort(String tenantId, LocalDate cohortStart) {
        List<UserCohortEntity> rows = userCohortRepository.findByTenantIdAndCohortMonthOrderByMonthNumberAsc(
                tenantId, cohortStart);
        if (rows.isEmpty()) {
            throw new NotFoundException("No cohort data found for tenant " + tenantId + ", cohort " + cohortStart);
        }
        return rows;
    }

    private static Double checkpoint(List<RetentionPoint> curve, int month) {
        return curve.stream()
                .filter(point -> point.getMonthNumber() == month)
                .findFirst()
                .map(point -> MoneyUtils.round2(point.getRetentionRate()))
                .orElse(null);
    }

    private static double month1OrZero(CohortComparison.CohortSnapshot snapshot) {
        return snapshot.getMonth1Retention() != null ? snapshot.getMonth1Retention() : 0.0;
    }
}
