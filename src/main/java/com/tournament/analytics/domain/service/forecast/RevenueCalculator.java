package com.tournament.analytics.domain.service.forecast;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.TrendDirection;
import com.tournament.analytics.domain.model.revenue.ChurnRate;
import com.tournament.analytics.domain.model.revenue.GrowthRate;
import com.tournament.analytics.domain.model.revenue.LifetimeValue;
import com.tournament.analytics.domain.model.revenue.MrrMetrics;
import com.tournament.analytics.domain.model.revenue.RevenueBreakdown;
import com.tournament.analytics.domain.model.revenue.RevenueProjection;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time revenue metrics read from monthly revenue aggregates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevenueCalculator {

    private static final int PROJECTION_HISTORY_MONTHS = 6;
    private static final BigDecimal PROJECTION_BAND = new BigDecimal("0.2");

    private final RevenueAggregateRepository revenueAggregateRepository;
    private final UserCohortRepository userCohortRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public MrrMetrics calculateMRR(String tenantId, LocalDate month) {
        LocalDate periodStart = month.withDayOfMonth(1);
        RevenueAggregateEntity current = requireMonth(tenantId, periodStart);
        Optional<RevenueAggregateEntity> previous = findMonth(tenantId, periodStart.minusMonths(1));

        BigDecimal mrr = MoneyUtils.scale(MoneyUtils.orZero(current.getMrr()));
        BigDecimal arr = MoneyUtils.scale(MoneyUtils.orZero(current.getArr()));

        BigDecimal previousMrr = previous.map(p -> MoneyUtils.scale(MoneyUtils.orZero(p.getMrr()))).orElse(null);
        BigDecimal previousArr = previous.map(p -> MoneyUtils.scale(MoneyUtils.orZero(p.getArr()))).orElse(null);

        Double growthRate = null;
        if (previousMrr != null && previousMrr.signum() > 0) {
            growthRate = MoneyUtils.round2(Statistics.percentChange(mrr.doubleValue(), previousMrr.doubleValue()));
        }

        int payments = current.getPaymentCount();
        Confidence confidence = payments > 10 ? Confidence.HIGH : payments > 3 ? Confidence.MEDIUM : Confidence.LOW;

        return MrrMetrics.builder()
                .mrr(mrr)
                .arr(arr)
                .periodStart(periodStart)
                .periodEnd(PeriodType.MONTH.endOf(periodStart))
                .previousMrr(previousMrr)
                .previousArr(previousArr)
                .growthRate(growthRate)
                .paymentCount(payments)
                .confidence(confidence)
                .build();
    }

    /**
     * Churned revenue as a share of total revenue for two months. Both months must be
     * aggregated; rates stay null while churned revenue is not recorded.
     */
    @Transactional(readOnly = true)
    public ChurnRate calculateChurnRate(String tenantId, LocalDate period, LocalDate previousPeriod) {
        LocalDate currentStart = period.withDayOfMonth(1);
        RevenueAggregateEntity current = requireMonth(tenantId, currentStart);
        RevenueAggregateEntity previous = requireMonth(tenantId, previousPeriod.withDayOfMonth(1));

        Double currentRate = churnRate(current);
        Double previousRate = churnRate(previous);

        ChurnRate.Trend trend;
        if (currentRate == null || previousRate == null) {
            trend = ChurnRate.Trend.UNAVAILABLE;
        } else if (Math.abs(currentRate - previousRate) < 0.5) {
            trend = ChurnRate.Trend.STABLE;
        } else {
            trend = currentRate > previousRate ? ChurnRate.Trend.INCREASING : ChurnRate.Trend.DECREASING;
        }

        return ChurnRate.builder()
                .periodStart(currentStart)
                .periodEnd(PeriodType.MONTH.endOf(currentStart))
                .rate(currentRate)
                .churnedRevenue(current.getChurnedRevenue())
                .totalRevenue(MoneyUtils.orZero(current.getTotalRevenue()))
                .previousRate(previousRate)
                .previousChurnedRevenue(previous.getChurnedRevenue())
                .trend(trend)
                .build();
    }

    public GrowthRate calculateGrowthRate(String metric, double currentValue, double previousValue) {
        double rate = Statistics.percentChange(currentValue, previousValue);
        return GrowthRate.builder()
                .metric(metric)
                .currentValue(currentValue)
                .previousValue(previousValue)
                .growthRate(MoneyUtils.round2(rate))
                .absoluteChange(MoneyUtils.round2(currentValue - previousValue))
                .trend(TrendDirection.of(rate, 1.0))
                .build();
    }

    /**
     * Compounds the last revenue at the average month-over-month growth of up to six
     * recent months, with a ±20% band. Needs at least three aggregated months.
     */
    @Transactional(readOnly = true)
    public RevenueProjection calculateRevenueProjection(String tenantId, int months) {
        AnalyticsValidationException.requireHorizon(months);
        LocalDate thisMonth = LocalDate.now(clock).withDayOfMonth(1);

        List<RevenueAggregateEntity> aggregates = revenueAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                        tenantId, PeriodType.MONTH, thisMonth.minusMonths(PROJECTION_HISTORY_MONTHS), thisMonth);

        if (aggregates.size() < 3) {
            throw new InsufficientDataException("revenue projection", 3, aggregates.size());
        }

        double totalGrowth = 0;
        int growthCount = 0;
        for (int i = 1; i < aggregates.size(); i++) {
            double previous = MoneyUtils.toDouble(aggregates.get(i - 1).getTotalRevenue());
            double current = MoneyUtils.toDouble(aggregates.get(i).getTotalRevenue());
            if (previous > 0) {
                totalGrowth += (current - previous) / previous * 100.0;
                growthCount++;
            }
        }
        double avgGrowthRate = growthCount > 0 ? totalGrowth / growthCount : 0.0;

        BigDecimal multiplier = BigDecimal.ONE.add(BigDecimal.valueOf(avgGrowthRate / 100.0));
        BigDecimal projection = MoneyUtils.orZero(aggregates.get(aggregates.size() - 1).getTotalRevenue());
        List<RevenueProjection.ProjectedMonth> projections = new ArrayList<>();

        for (int i = 1; i <= months; i++) {
            projection = projection.multiply(multiplier);
            BigDecimal band = projection.multiply(PROJECTION_BAND);
            projections.add(RevenueProjection.ProjectedMonth.builder()
                    .month(thisMonth.plusMonths(i))
                    .projectedRevenue(MoneyUtils.scale(projection))
                    .low(MoneyUtils.scale(projection.subtract(band)))
                    .high(MoneyUtils.scale(projection.add(band)))
                    .build());
        }

        int history = aggregates.size();
        Confidence confidence = history >= 6 ? Confidence.HIGH : history >= 4 ? Confidence.MEDIUM : Confidence.LOW;

        return RevenueProjection.builder()
                .projections(projections)
                .historicalMonths(history)
                .avgGrowthRate(MoneyUtils.round2(avgGrowthRate))
                .confidence(confidence)
                .build();
    }

    @Transactional(readOnly = true)
    public RevenueBreakdown getRevenueBreakdown(String tenantId, LocalDate month) {
        LocalDate periodStart = month.withDayOfMonth(1);
        RevenueAggregateEntity aggregate = requireMonth(tenantId, periodStart);

        BigDecimal total = MoneyUtils.orZero(aggregate.getTotalRevenue());
        BigDecimal existing = total
                .subtract(MoneyUtils.orZero(aggregate.getNewRevenue()))
                .subtract(MoneyUtils.orZero(aggregate.getExpansionRevenue()))
                .add(MoneyUtils.orZero(aggregate.getChurnedRevenue()))
                .max(BigDecimal.ZERO);

        int payments = aggregate.getPaymentCount();
        int successful = aggregate.getPaymentSuccessCount();

        return RevenueBreakdown.builder()
                .periodStart(periodStart)
                .periodEnd(PeriodType.MONTH.endOf(periodStart))
                .total(MoneyUtils.scale(total))
                .newRevenue(aggregate.getNewRevenue())
                .existingRevenue(MoneyUtils.scale(existing))
                .expansionRevenue(aggregate.getExpansionRevenue())
                .churnedRevenue(aggregate.getChurnedRevenue())
                .totalPayments(payments)
                .successRate(MoneyUtils.percentage(successful, payments))
                .avgTransactionValue(MoneyUtils.divide(total, successful))
                .refundRate(MoneyUtils.percentage(
                        MoneyUtils.toDouble(aggregate.getRefundAmount()), total.doubleValue()))
                .build();
    }

    /**
     * Average LTV of a cohort, annualised: ×12/monthsActive for young cohorts, ×1.2 after a year.
     */
    @Transactional(readOnly = true)
    public LifetimeValue calculateLifetimeValue(String tenantId, LocalDate cohortMonth) {
        LocalDate cohortStart = cohortMonth.withDayOfMonth(1);
        List<UserCohortEntity> rows = userCohortRepository.findByTenantIdAndCohortMonthOrderByMonthNumberAsc(
                tenantId, cohortStart);
        if (rows.isEmpty()) {
            throw new NotFoundException("No cohort data found for tenant " + tenantId + ", cohort " + cohortStart);
        }

        int cohortSize = rows.get(0).getCohortSize();
        BigDecimal totalRevenue = rows.stream()
                .map(row -> MoneyUtils.orZero(row.getRevenue()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal avgRevenuePerUser = MoneyUtils.divide(totalRevenue, cohortSize);

        BigDecimal latestLtv = rows.get(rows.size() - 1).getLifetimeValue();
        BigDecimal ltv = latestLtv != null ? latestLtv : avgRevenuePerUser;

        int monthsActive = rows.size();
        BigDecimal multiplier = monthsActive < 12
                ? MoneyUtils.divide(BigDecimal.valueOf(12), monthsActive)
                : new BigDecimal("1.2");
        Confidence confidence = monthsActive >= 6 ? Confidence.HIGH
                : monthsActive >= 3 ? Confidence.MEDIUM : Confidence.LOW;

        return LifetimeValue.builder()
                .cohortMonth(cohortStart)
                .avgLtv(MoneyUtils.scale(ltv))
                .totalRevenue(MoneyUtils.scale(totalRevenue))
                .cohortSize(cohortSize)
                .avgRevenuePerUser(avgRevenuePerUser)
                .projectedLtv(MoneyUtils.scale(ltv.multiply(multiplier)))
                .monthsActive(monthsActive)
                .confidence(confidence)
                .build();
    }

    private RevenueAggregateEntity requireMonth(String tenantId, LocalDate periodStart) {
        return findMonth(tenantId, periodStart)
                .orElseThrow(() -> new NotFoundException(
                        "No revenue data found for tenant " + tenantId + " in " + periodStart));
    }

    private Optional<RevenueAggregateEntity> findMonth(String tenantId, LocalDate periodStart) {
        return revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(
                tenantId, PeriodType.MONTH, periodStart);
    }

    private static Double churnRate(RevenueAggregateEntity aggregate) {
        if (aggregate.getChurnedRevenue() == null) {
            return null;
        }
        return MoneyUtils.percentage(
                aggregate.getChurnedRevenue().doubleValue(),
                MoneyUtils.toDouble(aggregate.getTotalRevenue()));
    }
}
