package com.tournament.analytics.domain.service.aggregation;

import com.tournament.analytics.domain.model.MoneyUtils;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.aggregation.AggregationSummary;
import com.tournament.analytics.domain.model.aggregation.PeriodBoundary;
import com.tournament.analytics.infrastructure.persistence.entity.PaymentEntity.PaymentStatus;
import com.tournament.analytics.infrastructure.persistence.entity.RefundEntity.RefundStatus;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentEntity;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import com.tournament.analytics.infrastructure.persistence.entity.UserEntity;
import com.tournament.analytics.infrastructure.persistence.repository.OrganizationRepository;
import com.tournament.analytics.infrastructure.persistence.repository.PaymentRepository;
import com.tournament.analytics.infrastructure.persistence.repository.RefundRepository;
import com.tournament.analytics.infrastructure.persistence.repository.RevenueAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentPlayerRepository;
import com.tournament.analytics.infrastructure.persistence.repository.TournamentRepository;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import com.tournament.analytics.infrastructure.persistence.repository.UserRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw payments, refunds, tournaments and signups into period aggregates.
 *
 * Every write is an upsert on the aggregate's natural key, so re-running a period
 * overwrites the previous row instead of adding one. Periods with no activity still get
 * a zero-valued row. Data access failures propagate to the caller.
 *
 * Periods are inclusive calendar dates, evaluated as [start 00:00, end+1 00:00) in the
 * analytics time zone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final RevenueAggregateRepository revenueAggregateRepository;
    private final UserCohortRepository userCohortRepository;
    private final TournamentAggregateRepository tournamentAggregateRepository;
    private final PaymentRepository paymentRepository;
    private final RefundRepository refundRepository;
    private final TournamentRepository tournamentRepository;
    private final TournamentPlayerRepository tournamentPlayerRepository;
    private final UserRepository userRepository;
    private final OrganizationRepository organizationRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public RevenueAggregateEntity aggregateRevenue(String tenantId, LocalDate periodStart, LocalDate periodEnd,
                                                   PeriodType periodType) {
        log.info("Computing revenue for tenant {}, period {} to {} ({})", tenantId, periodStart, periodEnd, periodType);
        Timer.Sample sample = Timer.start(meterRegistry);

        Instant from = startOfDay(periodStart);
        Instant to = startOfDay(periodEnd.plusDays(1));

        long paymentCount = paymentRepository.countInRange(tenantId, from, to);
        long successCount = paymentRepository.countByStatusInRange(tenantId, PaymentStatus.SUCCEEDED, from, to);
        long grossCents = paymentRepository.sumAmountByStatusInRange(tenantId, PaymentStatus.SUCCEEDED, from, to);
        long refundCount = refundRepository.countByStatusInRange(tenantId, RefundStatus.SUCCEEDED, from, to);
        long refundCents = refundRepository.sumAmountByStatusInRange(tenantId, RefundStatus.SUCCEEDED, from, to);

        BigDecimal netRevenue = MoneyUtils.fromCents(grossCents - refundCents);

        BigDecimal mrr = null;
        BigDecimal arr = null;
        if (periodType == PeriodType.MONTH) {
            mrr = netRevenue;
            arr = MoneyUtils.scale(netRevenue.multiply(BigDecimal.valueOf(12)));
        } else if (periodType == PeriodType.YEAR) {
            arr = netRevenue;
            mrr = MoneyUtils.divide(netRevenue, 12);
        }

        RevenueAggregateEntity aggregate = revenueAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStart(tenantId, periodType, periodStart)
                .orElseGet(() -> RevenueAggregateEntity.builder()
                        .tenantId(tenantId)
                        .periodType(periodType)
                        .periodStart(periodStart)
                        .build());

        aggregate.setPeriodEnd(periodEnd);
        aggregate.setMrr(mrr);
        aggregate.setArr(arr);
        aggregate.setNewRevenue(null);
        aggregate.setChurnedRevenue(null);
        aggregate.setExpansionRevenue(null);
        aggregate.setTotalRevenue(netRevenue);
        aggregate.setPaymentCount(Math.toIntExact(paymentCount));
        aggregate.setPaymentSuccessCount(Math.toIntExact(successCount));
        aggregate.setRefundCount(Math.toIntExact(refundCount));
        aggregate.setRefundAmount(MoneyUtils.fromCents(refundCents));

        RevenueAggregateEntity saved = revenueAggregateRepository.save(aggregate);

        recordLatency(sample, "revenue");
        log.info("Revenue aggregation complete for tenant {}: {} net from {} payments",
                tenantId, netRevenue, paymentCount);
        return saved;
    }

    /**
     * Recomputes every elapsed month of one signup cohort.
     *
     * A user is retained in month N when their last login falls between the cohort start
     * and the end of month N. Users who never logged in count as retained in month 0 only.
     *
     * @return rows written, 0 when the cohort has no members
     */
    @Transactional
    public int aggregateCohorts(String tenantId, LocalDate cohortMonth) {
        LocalDate cohortStart = cohortMonth.withDayOfMonth(1);
        log.info("Computing cohorts for tenant {}, month {}", tenantId, cohortStart);
        Timer.Sample sample = Timer.start(meterRegistry);

        List<UserEntity> members = userRepository.findTenantMembersCreatedBetween(
                tenantId, startOfDay(cohortStart), startOfDay(cohortStart.plusMonths(1)));
        int cohortSize = members.size();
        if (cohortSize == 0) {
            log.info("No users found for cohort {} of tenant {}", cohortStart, tenantId);
            recordLatency(sample, "cohort");
            return 0;
        }

        Set<String> memberIds = members.stream().map(UserEntity::getId).collect(Collectors.toSet());
        long monthsSinceCohort = Math.max(0, ChronoUnit.MONTHS.between(cohortStart, LocalDate.now(clock)));
        Instant cohortStartInstant = startOfDay(cohortStart);
        BigDecimal cumulativeRevenue = BigDecimal.ZERO;

        for (int monthNumber = 0; monthNumber <= monthsSinceCohort; monthNumber++) {
            LocalDate monthStart = cohortStart.plusMonths(monthNumber);
            Instant windowEnd = startOfDay(monthStart.plusMonths(1));

            int retained = 0;
            for (UserEntity user : members) {
                if (isRetained(user, monthNumber, cohortStartInstant, windowEnd)) {
                    retained++;
                }
            }

            BigDecimal revenue = MoneyUtils.fromCents(paymentRepository.sumAmountByStatusForUsersInRange(
                    tenantId, PaymentStatus.SUCCEEDED, memberIds, startOfDay(monthStart), windowEnd));
            cumulativeRevenue = cumulativeRevenue.add(revenue);

            upsertCohortRow(tenantId, cohortStart, monthNumber, cohortSize, retained, revenue,
                    MoneyUtils.divide(cumulativeRevenue, cohortSize));
        }

        recordLatency(sample, "cohort");
        log.info("Cohort aggregation complete for tenant {}, cohort {}: {} users, {} months",
                tenantId, cohortStart, cohortSize, monthsSinceCohort + 1);
        return (int) monthsSinceCohort + 1;
    }

    @Transactional
    public TournamentAggregateEntity aggregateTournaments(String tenantId, LocalDate periodStart, LocalDate periodEnd,
                                                          PeriodType periodType) {
        log.info("Computing tournaments for tenant {}, period {} to {} ({})",
                tenantId, periodStart, periodEnd, periodType);
        Timer.Sample sample = Timer.start(meterRegistry);

        List<TournamentEntity> tournaments = tournamentRepository.findCreatedBetween(
                tenantId, startOfDay(periodStart), startOfDay(periodEnd.plusDays(1)));

        TournamentAggregateEntity aggregate = tournamentAggregateRepository
                .findByTenantIdAndPeriodTypeAndPeriodStart(tenantId, periodType, periodStart)
                .orElseGet(() -> TournamentAggregateEntity.builder()
                        .tenantId(tenantId)
                        .periodType(periodType)
                        .periodStart(periodStart)
                        .build());
        aggregate.setPeriodEnd(periodEnd);

        if (tournaments.isEmpty()) {
            log.info("No tournaments found for tenant {} in period, writing zero row", tenantId);
            aggregate.setTournamentCount(0);
            aggregate.setCompletedCount(0);
            aggregate.setCompletionRate(MoneyUtils.scale(BigDecimal.ZERO));
            aggregate.setTotalPlayers(0);
            aggregate.setAvgPlayers(MoneyUtils.scale(BigDecimal.ZERO));
            aggregate.setAvgDurationMinutes(MoneyUtils.scale(BigDecimal.ZERO));
            aggregate.setMostPopularFormat(null);
            aggregate.setRevenue(MoneyUtils.scale(BigDecimal.ZERO));
            TournamentAggregateEntity saved = tournamentAggregateRepository.save(aggregate);
            recordLatency(sample, "tournament");
            return saved;
        }

        int tournamentCount = tournaments.size();
        int completedCount = (int) tournaments.stream().filter(TournamentEntity::isCompleted).count();

        List<String> tournamentIds = tournaments.stream().map(TournamentEntity::getId).toList();
        int totalPlayers = playerCounts(tournamentIds).values().stream().mapToInt(Long::intValue).sum();

        double avgDuration = tournaments.stream()
                .filter(TournamentEntity::isCompleted)
                .map(TournamentEntity::getDurationMinutes)
                .filter(duration -> duration != null)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);

        long revenueCents = paymentRepository.sumAmountByStatusForTournaments(
                tenantId, PaymentStatus.SUCCEEDED, tournamentIds);

        aggregate.setTournamentCount(tournamentCount);
        aggregate.setCompletedCount(completedCount);
        aggregate.setCompletionRate(BigDecimal.valueOf(MoneyUtils.percentage(completedCount, tournamentCount)));
        aggregate.setTotalPlayers(totalPlayers);
        aggregate.setAvgPlayers(MoneyUtils.divide(BigDecimal.valueOf(totalPlayers), tournamentCount));
        aggregate.setAvgDurationMinutes(BigDecimal.valueOf(MoneyUtils.round2(avgDuration)));
        aggregate.setMostPopularFormat(mostPopularFormat(tournaments));
        aggregate.setRevenue(MoneyUtils.fromCents(revenueCents));

        TournamentAggregateEntity saved = tournamentAggregateRepository.save(aggregate);

        recordLatency(sample, "tournament");
        log.info("Tournament aggregation complete for tenant {}: {} tournaments, {} completed",
                tenantId, tournamentCount, completedCount);
        return saved;
    }

    /**
     * Revenue and tournaments for the period, then the signup cohort of the period's month.
     * Any step failing aborts this tenant's run.
     */
    @Transactional
    public AggregationSummary aggregateAll(String tenantId, LocalDate periodStart, LocalDate periodEnd,
                                           PeriodType periodType) {
        long startTime = clock.millis();

        RevenueAggregateEntity revenue = aggregateRevenue(tenantId, periodStart, periodEnd, periodType);
        TournamentAggregateEntity tournaments = aggregateTournaments(tenantId, periodStart, periodEnd, periodType);
        LocalDate cohortMonth = periodStart.withDayOfMonth(1);
        int cohortRows = aggregateCohorts(tenantId, cohortMonth);

        long duration = clock.millis() - startTime;
        log.info("All aggregations complete for tenant {} ({} ms)", tenantId, duration);

        return AggregationSummary.builder()
                .tenantId(tenantId)
                .periodType(periodType)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .totalRevenue(revenue.getTotalRevenue())
                .tournamentCount(tournaments.getTournamentCount())
                .cohortMonth(cohortMonth)
                .cohortRowsWritten(cohortRows)
                .durationMs(duration)
                .build();
    }

    @Transactional(readOnly = true)
    public List<String> getActiveTenants() {
        return organizationRepository.findAllIds();
    }

    /**
     * Day, week, month, quarter and year buckets containing {@code date}.
     */
    public Map<PeriodType, PeriodBoundary> getStandardPeriods(LocalDate date) {
        Map<PeriodType, PeriodBoundary> periods = new EnumMap<>(PeriodType.class);
        for (PeriodType type : PeriodType.values()) {
            periods.put(type, PeriodBoundary.containing(date, type));
        }
        return periods;
    }

    private void recordLatency(Timer.Sample sample, String step) {
        sample.stop(Timer.builder("analytics.aggregation")
                .tag("step", step)
                .register(meterRegistry));
    }

    private boolean isRetained(UserEntity user, int monthNumber, Instant cohortStart, Instant windowEnd) {
        Instant lastLogin = user.getLastLoginAt();
        if (lastLogin == null) {
            return monthNumber == 0;
        }
        return !lastLogin.isBefore(cohortStart) && lastLogin.isBefore(windowEnd);
    }

    private void upsertCohortRow(String tenantId, LocalDate cohortMonth, int monthNumber, int cohortSize,
                                 int retained, BigDecimal revenue, BigDecimal lifetimeValue) {
        UserCohortEntity row = userCohortRepository
                .findByTenantIdAndCohortMonthAndMonthNumber(tenantId, cohortMonth, monthNumber)
                .orElseGet(() -> UserCohortEntity.builder()
                        .tenantId(tenantId)
                        .cohortMonth(cohortMonth)
                        .monthNumber(monthNumber)
                        .build());

        row.setCohortSize(cohortSize);
        row.setRetainedUsers(retained);
        row.setRetentionRate(BigDecimal.valueOf(MoneyUtils.percentage(retained, cohortSize)));
        row.setRevenue(revenue);
        row.setLifetimeValue(lifetimeValue);
        userCohortRepository.save(row);
    }

    private Map<String, Long> playerCounts(List<String> tournamentIds) {
        Map<String, Long> counts = new HashMap<>();
        for (Object[] row : tournamentPlayerRepository.countByTournamentIds(tournamentIds)) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    /**
     * Format with the most tournaments; ties go to the format seen first.
     */
    static String mostPopularFormat(List<TournamentEntity> tournaments) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TournamentEntity tournament : tournaments) {
            counts.merge(tournament.getFormat(), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private Instant startOfDay(LocalDate date) {
        ZoneId zone = clock.getZone();
        return date.atStartOfDay(zone).toInstant();
    }
}
