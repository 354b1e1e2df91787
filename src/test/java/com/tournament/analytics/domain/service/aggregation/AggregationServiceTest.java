package com.tournament.analytics.domain.service.aggregation;

import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.aggregation.PeriodBoundary;
import com.tournament.analytics.infrastructure.persistence.entity.PaymentEntity.PaymentStatus;
import com.tournament.analytics.infrastructure.persistence.entity.RefundEntity.RefundStatus;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentEntity;
import com.tournament.analytics.infrastructure.persistence.entity.TournamentEntity.TournamentStatus;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AggregationService.
 *
 * Aggregates are upserts, so most tests check that a second run rewrites the same row.
 */
@ExtendWith(MockitoExtension.class)
class AggregationServiceTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private RevenueAggregateRepository revenueAggregateRepository;
    @Mock
    private UserCohortRepository userCohortRepository;
    @Mock
    private TournamentAggregateRepository tournamentAggregateRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private RefundRepository refundRepository;
    @Mock
    private TournamentRepository tournamentRepository;
    @Mock
    private TournamentPlayerRepository tournamentPlayerRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private OrganizationRepository organizationRepository;

    private SimpleMeterRegistry meterRegistry;
    private AggregationService aggregationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        aggregationService = new AggregationService(revenueAggregateRepository, userCohortRepository,
                tournamentAggregateRepository, paymentRepository, refundRepository, tournamentRepository,
                tournamentPlayerRepository, userRepository, organizationRepository, meterRegistry, clock);
    }

    @Test
    void testAggregateRevenue_MonthDerivesMrrAndArr() {
        // Given
        stubPayments(150_000L, 50_000L);
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(any(), any(), any()))
                .thenReturn(Optional.empty());
        when(revenueAggregateRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        RevenueAggregateEntity result = aggregationService.aggregateRevenue(
                TENANT, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29), PeriodType.MONTH);

        // Then
        assertEquals(new BigDecimal("1000.00"), result.getTotalRevenue());
        assertEquals(new BigDecimal("1000.00"), result.getMrr());
        assertEquals(new BigDecimal("12000.00"), result.getArr());
        assertEquals(new BigDecimal("500.00"), result.getRefundAmount());
        assertEquals(12, result.getPaymentCount());
        assertEquals(10, result.getPaymentSuccessCount());
        assertNull(result.getNewRevenue());
        assertNull(result.getChurnedRevenue());
    }

    @Test
    void testAggregateRevenue_DayLeavesMrrUnset() {
        // Given
        stubPayments(10_000L, 0L);
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(any(), any(), any()))
                .thenReturn(Optional.empty());
        when(revenueAggregateRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        LocalDate day = LocalDate.of(2024, 3, 14);
        RevenueAggregateEntity result = aggregationService.aggregateRevenue(TENANT, day, day, PeriodType.DAY);

        // Then
        assertNull(result.getMrr());
        assertNull(result.getArr());
        assertEquals(new BigDecimal("100.00"), result.getTotalRevenue());
    }

    @Test
    void testAggregateRevenue_RerunOverwritesExistingRow() {
        // Given
        LocalDate start = LocalDate.of(2024, 2, 1);
        RevenueAggregateEntity existing = RevenueAggregateEntity.builder()
                .tenantId(TENANT)
                .periodType(PeriodType.MONTH)
                .periodStart(start)
                .totalRevenue(new BigDecimal("1.00"))
                .build();
        stubPayments(150_000L, 50_000L);
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(TENANT, PeriodType.MONTH, start))
                .thenReturn(Optional.of(existing));
        when(revenueAggregateRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        aggregationService.aggregateRevenue(TENANT, start, LocalDate.of(2024, 2, 29), PeriodType.MONTH);
        aggregationService.aggregateRevenue(TENANT, start, LocalDate.of(2024, 2, 29), PeriodType.MONTH);

        // Then
        ArgumentCaptor<RevenueAggregateEntity> captor = ArgumentCaptor.forClass(RevenueAggregateEntity.class);
        verify(revenueAggregateRepository, times(2)).save(captor.capture());
        assertSame(existing, captor.getAllValues().get(0));
        assertSame(existing, captor.getAllValues().get(1));
        assertEquals(new BigDecimal("1000.00"), existing.getTotalRevenue());
    }

    @Test
    void testAggregateCohorts_NoMembersWritesNothing() {
        // Given
        when(userRepository.findTenantMembersCreatedBetween(eq(TENANT), any(), any()))
                .thenReturn(Collections.emptyList());

        // When
        int rows = aggregationService.aggregateCohorts(TENANT, LocalDate.of(2024, 1, 10));

        // Then
        assertEquals(0, rows);
        verify(userCohortRepository, never()).save(any());
        assertEquals(1, meterRegistry.timer("analytics.aggregation", "step", "cohort").count());
    }

    @Test
    void testAggregateCohorts_OneRowPerElapsedMonth() {
        // Given
        List<UserEntity> members = List.of(
                user("u1", Instant.parse("2024-03-10T10:00:00Z")),
                user("u2", Instant.parse("2024-01-20T10:00:00Z")),
                user("u3", null));
        when(userRepository.findTenantMembersCreatedBetween(eq(TENANT), any(), any())).thenReturn(members);
        when(userCohortRepository.findByTenantIdAndCohortMonthAndMonthNumber(eq(TENANT), any(), anyInt()))
                .thenReturn(Optional.empty());
        when(paymentRepository.sumAmountByStatusForUsersInRange(eq(TENANT), eq(PaymentStatus.SUCCEEDED),
                anyCollection(), any(), any())).thenReturn(3_000L);

        // When
        int rows = aggregationService.aggregateCohorts(TENANT, LocalDate.of(2024, 1, 10));

        // Then
        assertEquals(3, rows);
        ArgumentCaptor<UserCohortEntity> captor = ArgumentCaptor.forClass(UserCohortEntity.class);
        verify(userCohortRepository, times(3)).save(captor.capture());

        List<UserCohortEntity> saved = captor.getAllValues();
        UserCohortEntity month0 = saved.get(0);
        assertEquals(LocalDate.of(2024, 1, 1), month0.getCohortMonth());
        assertEquals(0, month0.getMonthNumber());
        assertEquals(3, month0.getCohortSize());
        // u2 logged in during January, u3 never logged in
        assertEquals(2, month0.getRetainedUsers());
        assertEquals(new BigDecimal("66.67"), month0.getRetentionRate().setScale(2));

        UserCohortEntity month2 = saved.get(2);
        assertEquals(2, month2.getMonthNumber());
        assertEquals(2, month2.getRetainedUsers());
        assertEquals(new BigDecimal("30.00"), month2.getLifetimeValue());
    }

    @Test
    void testAggregateTournaments_EmptyPeriodWritesZeroRow() {
        // Given
        when(tournamentRepository.findCreatedBetween(eq(TENANT), any(), any())).thenReturn(Collections.emptyList());
        when(tournamentAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(any(), any(), any()))
                .thenReturn(Optional.empty());
        when(tournamentAggregateRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        LocalDate day = LocalDate.of(2024, 3, 14);
        TournamentAggregateEntity result = aggregationService.aggregateTournaments(TENANT, day, day, PeriodType.DAY);

        // Then
        assertEquals(0, result.getTournamentCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(result.getRevenue()));
        assertNull(result.getMostPopularFormat());
        verify(paymentRepository, never()).sumAmountByStatusForTournaments(any(), any(), any());
        assertEquals(1, meterRegistry.timer("analytics.aggregation", "step", "tournament").count());
    }

    @Test
    void testAggregateTournaments_ComputesRatesAndAverages() {
        // Given
        List<TournamentEntity> tournaments = List.of(
                tournament("t1", "8-ball", TournamentStatus.COMPLETED, 120),
                tournament("t2", "9-ball", TournamentStatus.COMPLETED, 60),
                tournament("t3", "8-ball", TournamentStatus.CANCELLED, 0));
        when(tournamentRepository.findCreatedBetween(eq(TENANT), any(), any())).thenReturn(tournaments);
        List<Object[]> playerRows = new ArrayList<>();
        playerRows.add(new Object[]{"t1", 16L});
        playerRows.add(new Object[]{"t2", 8L});
        when(tournamentPlayerRepository.countByTournamentIds(anyCollection())).thenReturn(playerRows);
        when(paymentRepository.sumAmountByStatusForTournaments(eq(TENANT), eq(PaymentStatus.SUCCEEDED), anyCollection()))
                .thenReturn(48_000L);
        when(tournamentAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(any(), any(), any()))
                .thenReturn(Optional.empty());
        when(tournamentAggregateRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        TournamentAggregateEntity result = aggregationService.aggregateTournaments(
                TENANT, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31), PeriodType.MONTH);

        // Then
        assertEquals(3, result.getTournamentCount());
        assertEquals(2, result.getCompletedCount());
        assertEquals(0, new BigDecimal("66.67").compareTo(result.getCompletionRate()));
        assertEquals(24, result.getTotalPlayers());
        assertEquals(new BigDecimal("8.00"), result.getAvgPlayers());
        assertEquals(0, new BigDecimal("90").compareTo(result.getAvgDurationMinutes()));
        assertEquals("8-ball", result.getMostPopularFormat());
        assertEquals(new BigDecimal("480.00"), result.getRevenue());
    }

    @Test
    void testMostPopularFormat_TieGoesToFirstSeen() {
        // Given
        List<TournamentEntity> tournaments = List.of(
                tournament("t1", "9-ball", TournamentStatus.COMPLETED, 30),
                tournament("t2", "8-ball", TournamentStatus.COMPLETED, 30));

        // When / Then
        assertEquals("9-ball", AggregationService.mostPopularFormat(tournaments));
    }

    @Test
    void testGetStandardPeriods() {
        // When
        Map<PeriodType, PeriodBoundary> periods = aggregationService.getStandardPeriods(LocalDate.of(2024, 5, 15));

        // Then
        assertEquals(LocalDate.of(2024, 5, 13), periods.get(PeriodType.WEEK).getStart());
        assertEquals(LocalDate.of(2024, 5, 19), periods.get(PeriodType.WEEK).getEnd());
        assertEquals(LocalDate.of(2024, 4, 1), periods.get(PeriodType.QUARTER).getStart());
        assertEquals(LocalDate.of(2024, 6, 30), periods.get(PeriodType.QUARTER).getEnd());
    }

    private void stubPayments(long grossCents, long refundCents) {
        when(paymentRepository.countInRange(eq(TENANT), any(), any())).thenReturn(12L);
        when(paymentRepository.countByStatusInRange(eq(TENANT), eq(PaymentStatus.SUCCEEDED), any(), any()))
                .thenReturn(10L);
        when(paymentRepository.sumAmountByStatusInRange(eq(TENANT), eq(PaymentStatus.SUCCEEDED), any(), any()))
                .thenReturn(grossCents);
        when(refundRepository.countByStatusInRange(eq(TENANT), eq(RefundStatus.SUCCEEDED), any(), any()))
                .thenReturn(refundCents > 0 ? 1L : 0L);
        when(refundRepository.sumAmountByStatusInRange(eq(TENANT), eq(RefundStatus.SUCCEEDED), any(), any()))
                .thenReturn(refundCents);
    }

    private static UserEntity user(String id, Instant lastLogin) {
        return UserEntity.builder()
                .id(id)
                .createdAt(Instant.parse("2024-01-05T00:00:00Z"))
                .lastLoginAt(lastLogin)
                .build();
    }

    private static TournamentEntity tournament(String id, String format, TournamentStatus status, int minutes) {
        Instant started = Instant.parse("2024-03-02T18:00:00Z");
        return TournamentEntity.builder()
                .id(id)
                .orgId(TENANT)
                .format(format)
                .status(status)
                .createdAt(Instant.parse("2024-03-01T10:00:00Z"))
                .startedAt(status == TournamentStatus.COMPLETED ? started : null)
                .completedAt(status == TournamentStatus.COMPLETED ? started.plusSeconds(minutes * 60L) : null)
                .build();
    }
}
