package com.tournament.analytics.domain.service.forecast;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.ConfidenceInterval;
import com.tournament.analytics.domain.model.PeriodType;
import com.tournament.analytics.domain.model.forecast.RevenueForecast;
import com.tournament.analytics.domain.model.forecast.Trendline;
import com.tournament.analytics.domain.model.forecast.UserGrowthForecast;
import com.tournament.analytics.infrastructure.persistence.entity.RevenueAggregateEntity;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
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
import java.time.Month;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RevenueForecasterTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private RevenueAggregateRepository revenueAggregateRepository;

    @Mock
    private UserCohortRepository userCohortRepository;

    private RevenueForecaster forecaster;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        forecaster = new RevenueForecaster(revenueAggregateRepository, userCohortRepository, clock);
    }

    @Test
    void testCalculateTrendline_PerfectLine() {
        // When
        Trendline trendline = forecaster.calculateTrendline(List.of(10.0, 20.0, 30.0, 40.0));

        // Then
        assertEquals(10.0, trendline.getSlope(), 1e-9);
        assertEquals(10.0, trendline.getIntercept(), 1e-9);
        assertEquals(1.0, trendline.getRSquared(), 1e-9);
        assertEquals("y = 10.00x + 10.00", trendline.getEquation());
    }

    @Test
    void testCalculateTrendline_FlatSeriesHasZeroRSquared() {
        // When
        Trendline trendline = forecaster.calculateTrendline(List.of(5.0, 5.0, 5.0));

        // Then
        assertEquals(0.0, trendline.getSlope(), 1e-9);
        assertEquals(5.0, trendline.getIntercept(), 1e-9);
        assertEquals(0.0, trendline.getRSquared(), 1e-9);
    }

    @Test
    void testCalculateTrendline_SinglePointRejected() {
        // When / Then
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> forecaster.calculateTrendline(List.of(1.0)));
        assertEquals(2, ex.getRequired());
        assertEquals(1, ex.getActual());
    }

    @Test
    void testDetectSeasonality_ShortSeriesIsEmpty() {
        // Given
        Map<YearMonth, Double> series = new LinkedHashMap<>();
        for (int i = 0; i < 11; i++) {
            series.put(YearMonth.of(2023, 1).plusMonths(i), 100.0 + i);
        }

        // When / Then
        assertTrue(forecaster.detectSeasonality(series).isEmpty());
    }

    @Test
    void testDetectSeasonality_UniformSeriesIsNeutral() {
        // Given
        Map<YearMonth, Double> series = new LinkedHashMap<>();
        for (int i = 0; i < 12; i++) {
            series.put(YearMonth.of(2023, 1).plusMonths(i), 250.0);
        }

        // When
        Map<Month, Double> factors = forecaster.detectSeasonality(series);

        // Then
        assertEquals(12, factors.size());
        factors.values().forEach(factor -> assertEquals(1.0, factor, 1e-9));
    }

    @Test
    void testCalculateConfidenceInterval_UsesStandardError() {
        // Given
        List<Double> history = List.of(2.0, 4.0, 4.0, 6.0);

        // When
        ConfidenceInterval interval = forecaster.calculateConfidenceInterval(100.0, history, 0.95);

        // Then
        assertEquals(100.0 - 1.96 * Math.sqrt(2) / 2, interval.getLower(), 1e-9);
        assertEquals(100.0 + 1.96 * Math.sqrt(2) / 2, interval.getUpper(), 1e-9);
    }

    @Test
    void testPredictRevenue_LinearHistory() {
        // Given
        List<RevenueAggregateEntity> history = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            history.add(monthly(YearMonth.of(2023, 7).plusMonths(i), 1000 + 100 * i));
        }
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                TENANT, PeriodType.MONTH, LocalDate.of(2023, 7, 1), LocalDate.of(2024, 6, 1)))
                .thenReturn(history);

        // When
        RevenueForecast forecast = forecaster.predictRevenue(TENANT, 3);

        // Then
        assertEquals(3, forecast.getPredictions().size());
        assertEquals(YearMonth.of(2024, 7), forecast.getPredictions().get(0).getMonth());
        assertEquals(12, forecast.getNonZeroMonths());
        assertEquals(Confidence.HIGH, forecast.getConfidence());
        assertEquals(100, forecast.getAccuracy());
        assertEquals(100.0, forecast.getTrendline().getSlope(), 1e-6);
        forecast.getPredictions().forEach(prediction -> {
            assertTrue(prediction.getLow().compareTo(prediction.getPredictedMrr()) <= 0);
            assertTrue(prediction.getHigh().compareTo(prediction.getPredictedMrr()) >= 0);
        });
    }

    @Test
    void testPredictRevenue_TooFewNonZeroMonths() {
        // Given
        when(revenueAggregateRepository.findByTenantIdAndPeriodTypeAndPeriodStartBetweenOrderByPeriodStartAsc(
                eq(TENANT), eq(PeriodType.MONTH), any(), any()))
                .thenReturn(List.of(monthly(YearMonth.of(2024, 5), 500), monthly(YearMonth.of(2024, 6), 600)));

        // When / Then
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> forecaster.predictRevenue(TENANT, 6));
        assertEquals(3, ex.getRequired());
        assertEquals(2, ex.getActual());
    }

    @Test
    void testPredictRevenue_HorizonOutOfRange() {
        assertThrows(AnalyticsValidationException.class, () -> forecaster.predictRevenue(TENANT, 13));
        assertThrows(AnalyticsValidationException.class, () -> forecaster.predictRevenue(TENANT, 0));
        verifyNoInteractions(revenueAggregateRepository);
    }

    @Test
    void testPredictUserGrowth_DefaultChurnWithoutMonthOneData() {
        // Given
        when(userCohortRepository.findByTenantIdAndMonthNumberOrderByCohortMonthAsc(TENANT, 0)).thenReturn(List.of(
                signups(YearMonth.of(2024, 4), 100),
                signups(YearMonth.of(2024, 5), 110),
                signups(YearMonth.of(2024, 6), 121)));
        when(userCohortRepository.findByTenantIdAndMonthNumberOrderByCohortMonthAsc(TENANT, 1))
                .thenReturn(Collections.emptyList());

        // When
        UserGrowthForecast forecast = forecaster.predictUserGrowth(TENANT, 2);

        // Then
        assertFalse(forecast.isChurnMeasured());
        assertEquals(20.0, forecast.getAvgChurnRate());
        assertEquals(10.0, forecast.getAvgGrowthRate());
        assertEquals(Confidence.HIGH, forecast.getConfidence());

        UserGrowthForecast.UserGrowthPrediction first = forecast.getPredictions().get(0);
        assertEquals(12, first.getNewUsers());
        assertEquals(24, first.getChurnedUsers());
        assertEquals(109, first.getPredictedUsers());
    }

    @Test
    void testPredictUserGrowth_NeedsThreeCohorts() {
        // Given
        when(userCohortRepository.findByTenantIdAndMonthNumberOrderByCohortMonthAsc(TENANT, 0))
                .thenReturn(List.of(signups(YearMonth.of(2024, 6), 50)));

        // When / Then
        assertThrows(InsufficientDataException.class, () -> forecaster.predictUserGrowth(TENANT, 3));
    }

    private static RevenueAggregateEntity monthly(YearMonth month, long mrr) {
        return RevenueAggregateEntity.builder()
                .tenantId(TENANT)
                .periodType(PeriodType.MONTH)
                .periodStart(month.atDay(1))
                .periodEnd(month.atEndOfMonth())
                .mrr(BigDecimal.valueOf(mrr))
                .totalRevenue(BigDecimal.valueOf(mrr))
                .build();
    }

    private static UserCohortEntity signups(YearMonth month, int size) {
        return UserCohortEntity.builder()
                .tenantId(TENANT)
                .cohortMonth(month.atDay(1))
                .monthNumber(0)
                .cohortSize(size)
                .retainedUsers(size)
                .retentionRate(new BigDecimal("100.00"))
                .build();
    }
}
