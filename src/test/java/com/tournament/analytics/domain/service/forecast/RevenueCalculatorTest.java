package com.tournament.analytics.domain.service.forecast;

import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.TrendDirection;
import com.tournament.analytics.domain.model.revenue.ChurnRate;
import com.tournament.analytics.domain.model.revenue.GrowthRate;
import com.tournament.analytics.domain.model.revenue.MrrMetrics;
import com.tournament.analytics.domain.model.revenue.RevenueBreakdown;
import com.tournament.analytics.domain.model.revenue.RevenueProjection;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.repository.RevenueAggregateRepository;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RevenueCalculator.
 */
@ExtendWith(MockitoExtension.class)
class RevenueCalculatorTest {

    private static final String TENANT = "tenant-1";
    private static final LocalDate MAY = LocalDate.of(2024, 5, 1);
    private static final LocalDate JUNE = LocalDate.of(2024, 6, 1);

    @Mock
    private RevenueAggregateRepository revenueAggregateRepository;

    @Mock
    private UserCohortRepository userCohortRepository;

    private RevenueCalculator revenueCalculator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        revenueCalculator = new RevenueCalculator(revenueAggregateRepository, userCohortRepository, clock);
    }

    @Test
    void testCalculateMRR_GrowthAgainstPreviousMonth() {
        // Given
        RevenueAggregateEntity june = month(JUNE, "1100.00");
        june.setPaymentCount(12);
        stubMonth(JUNE, june);
        stubMonth(MAY, month(MAY, "1000.00"));

        // When
        MrrMetrics metrics = revenueCalculator.calculateMRR(TENANT, LocalDate.of(2024, 6, 20));

        // Then
        assertEquals(new BigDecimal("1100.00"), metrics.getMrr());
        assertEquals(new BigDecimal("13200.00"), metrics.getArr());
        assertEquals(new BigDecimal("1000.00"), metrics.getPreviousMrr());
        assertEquals(10.0, metrics.getGrowthRate());
        assertEquals(LocalDate.of(2024, 6, 30), metrics.getPeriodEnd());
        assertEquals(Confidence.HIGH, metrics.getConfidence());
    }

    @Test
    void testCalculateMRR_NoPreviousMonth() {
        // Given
        stubMonth(JUNE, month(JUNE, "500.00"));
        stubMonth(MAY, null);

        // When
        MrrMetrics metrics = revenueCalculator.calculateMRR(TENANT, JUNE);

        // Then
        assertNull(metrics.getPreviousMrr());
        assertNull(metrics.getGrowthRate());
        assertEquals(Confidence.LOW, metrics.getConfidence());
    }

    @Test
    void testCalculateMRR_MissingMonth() {
        // Given
        stubMonth(JUNE, null);

        // When / Then
        assertThrows(NotFoundException.class, () -> revenueCalculator.calculateMRR(TENANT, JUNE));
    }

    @Test
    void testCalculateChurnRate_UnavailableWithoutChurnedRevenue() {
        // Given
        stubMonth(JUNE, month(JUNE, "1100.00"));
        stubMonth(MAY, month(MAY, "1000.00"));

        // When
        ChurnRate churn = revenueCalculator.calculateChurnRate(TENANT, JUNE, MAY);

        // Then
        assertNull(churn.getRate());
        assertEquals(ChurnRate.Trend.UNAVAILABLE, churn.getTrend());
    }

    @Test
    void testCalculateGrowthRate_DeadBand() {
        // When
        GrowthRate up = revenueCalculator.calculateGrowthRate("players", 120, 100);
        GrowthRate flat = revenueCalculator.calculateGrowthRate("players", 100.5, 100);

        // Then
        assertEquals(20.0, up.getGrowthRate());
        assertEquals(20.0, up.getAbsoluteChange());
        assertEquals(TrendDirection.UP, up.getTrend());
        assertEquals(TrendDirection.FLAT, flat.getTrend());
    }

    @Test
    void testCalculateRevenueProjection_FlatHistory() {
        // Given
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                TENANT, PeriodType.MONTH, LocalDate.of(2023, 12, 1), JUNE))
                .thenReturn(List.of(
                        month(LocalDate.of(2024, 4, 1), "1000.00"),
                        month(MAY, "1000.00"),
                        month(JUNE, "1000.00")));

        // When
        RevenueProjection projection = revenueCalculator.calculateRevenueProjection(TENANT, 2);

        // Then
        assertEquals(2, projection.getProjections().size());
        assertEquals(0.0, projection.getAvgGrowthRate());
        assertEquals(Confidence.LOW, projection.getConfidence());

        RevenueProjection.ProjectedMonth july = projection.getProjections().get(0);
        assertEquals(LocalDate.of(2024, 7, 1), july.getMonth());
        assertEquals(0, july.getProjectedRevenue().compareTo(new BigDecimal("1000")));
        assertEquals(0, july.getLow().compareTo(new BigDecimal("800")));
        assertEquals(0, july.getHigh().compareTo(new BigDecimal("1200")));
    }

    @Test
    void testCalculateRevenueProjection_CompoundsAverageGrowth() {
        // Given
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                eq(TENANT), eq(PeriodType.MONTH), any(), any()))
                .thenReturn(List.of(
                        month(LocalDate.of(2024, 4, 1), "1000.00"),
                        month(MAY, "1100.00"),
                        month(JUNE, "1210.00")));

        // When
        RevenueProjection projection = revenueCalculator.calculateRevenueProjection(TENANT, 1);

        // Then
        assertEquals(10.0, projection.getAvgGrowthRate());
        assertEquals(new BigDecimal("1331.00"), projection.getProjections().get(0).getProjectedRevenue());
    }

    @Test
    void testCalculateRevenueProjection_NeedsThreeMonths() {
        // Given
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                eq(TENANT), eq(PeriodType.MONTH), any(), any()))
                .thenReturn(List.of(month(MAY, "1000.00"), month(JUNE, "1000.00")));

        // When / Then
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> revenueCalculator.calculateRevenueProjection(TENANT, 3));
        assertEquals(3, ex.getRequired());
        assertEquals(2, ex.getActual());
    }

    @Test
    void testGetRevenueBreakdown_Rates() {
        // Given
        RevenueAggregateEntity june = month(JUNE, "1000.00");
        june.setPaymentCount(10);
        june.setPaymentSuccessCount(8);
        june.setRefundAmount(new BigDecimal("50.00"));
        stubMonth(JUNE, june);

        // When
        RevenueBreakdown breakdown = revenueCalculator.getRevenueBreakdown(TENANT, JUNE);

        // Then
        assertEquals(new BigDecimal("1000.00"), breakdown.getTotal());
        assertEquals(new BigDecimal("1000.00"), breakdown.getExistingRevenue());
        assertNull(breakdown.getNewRevenue());
        assertEquals(80.0, breakdown.getSuccessRate());
        assertEquals(new BigDecimal("125.00"), breakdown.getAvgTransactionValue());
        assertEquals(5.0, breakdown.getRefundRate());
    }

    @Test
    void testGetRevenueBreakdown_Missing() {
        // Given
        stubMonth(JUNE, null);

        // When / Then
        assertThrows(NotFoundException.class, () -> revenueCalculator.getRevenueBreakdown(TENANT, JUNE));
    }

    private void stubMonth(LocalDate periodStart, RevenueAggregateEntity aggregate) {
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStart(TENANT, PeriodType.MONTH, periodStart))
                .thenReturn(Optional.ofNullable(aggregate));
    }

    private static RevenueAggregateEntity month(LocalDate periodStart, String revenue) {
        BigDecimal amount = new BigDecimal(revenue);
        return RevenueAggregateEntity.builder()
                .tenantId(TENANT)
                .periodType(PeriodType.MONTH)
                .periodStart(periodStart)
                .periodEnd(periodStart.withDayOfMonth(periodStart.lengthOfMonth()))
                .mrr(amount)
                .arr(amount.multiply(BigDecimal.valueOf(12)))
                .totalRevenue(amount)
                .build();
    }
}
