package com.tournament.analytics.domain.service.cohort;

import com.tournament.analytics.domain.exception.AnalyticsValidationException;
import com.tournament.analytics.domain.exception.InsufficientDataException;
import com.tournament.analytics.domain.exception.NotFoundException;
import com.tournament.analytics.domain.model.BenchmarkStatus;
import com.tournament.analytics.domain.model.Confidence;
import com.tournament.analytics.domain.model.cohort.CohortAnalysis;
import com.tournament.analytics.domain.model.cohort.CohortComparison;
import com.tournament.analytics.domain.model.cohort.CohortLtv;
import com.tournament.analytics.domain.model.cohort.RetentionBenchmarks;
import com.tournament.analytics.domain.model.cohort.RetentionPrediction;
import com.tournament.analytics.domain.model.cohort.RetentionTrend;
import com.tournament.analytics.infrastructure.persistence.entity.UserCohortEntity;
import com.tournament.analytics.infrastructure.persistence.repository.UserCohortRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for CohortAnalyzer.
 */
@ExtendWith(MockitoExtension.class)
class CohortAnalyzerTest {

    private static final String TENANT = "tenant-1";
    private static final LocalDate JANUARY = LocalDate.of(2024, 1, 1);
    private static final LocalDate FEBRUARY = LocalDate.of(2024, 2, 1);

    @Mock
    private UserCohortRepository userCohortRepository;

    private CohortAnalyzer cohortAnalyzer;

    @BeforeEach
    void setUp() {
        cohortAnalyzer = new CohortAnalyzer(userCohortRepository);
    }

    @Test
    void testAnalyzeCohort_CheckpointsOnlyWhenReached() {
        // Given
        stubCohort(JANUARY, 100.0, 60.0, 45.0, 40.0, 35.0, 30.0);

        // When
        CohortAnalysis analysis = cohortAnalyzer.analyzeCohort(TENANT, LocalDate.of(2024, 1, 20));

        // Then
        assertEquals(JANUARY, analysis.getCohortMonth());
        assertEquals(100, analysis.getCohortSize());
        assertEquals(6, analysis.getRetentionCurve().size());
        assertEquals(60.0, analysis.getMonth1Retention());
        assertEquals(40.0, analysis.getMonth3Retention());
        assertNull(analysis.getMonth6Retention());
        assertNull(analysis.getMonth12Retention());
        assertEquals(51.67, analysis.getAvgRetentionRate());

        // month 0 never counts as churn
        assertEquals(0, analysis.getRetentionCurve().get(0).getChurnedUsers());
        assertEquals(40, analysis.getRetentionCurve().get(1).getChurnedUsers());
        assertEquals(40.0, analysis.getRetentionCurve().get(1).getChurnRate());
    }

    @Test
    void testAnalyzeCohort_Missing() {
        // Given
        when(userCohortRepository.findByTenantIdAndCohortMonthOrderByMonthNumberAsc(TENANT, JANUARY))
                .thenReturn(Collections.emptyList());

        // When / Then
        assertThrows(NotFoundException.class, () -> cohortAnalyzer.analyzeCohort(TENANT, JANUARY));
    }

    @Test
    void testCalculateCohortLtv_ProjectionFactorFollowsRetention() {
        // Given
        stubCohort(JANUARY, 100.0, 50.0, 25.0);

        // When
        CohortLtv ltv = cohortAnalyzer.calculateCohortLtv(TENANT, JANUARY);

        // Then
        assertEquals(new BigDecimal("3.00"), ltv.getCurrentLtv());
        assertEquals(new BigDecimal("4.50"), ltv.getProjectedLtv());
        assertEquals(3, ltv.getRevenueByMonth().size());
        assertEquals(Confidence.MEDIUM, ltv.getConfidence());
    }

    @Test
    void testCompareCohortsRetention_RanksByMonthOne() {
        // Given
        stubCohort(JANUARY, 100.0, 40.0, 30.0);
        stubCohort(FEBRUARY, 100.0, 55.0);

        // When
        CohortComparison comparison = cohortAnalyzer.compareCohortsRetention(TENANT, List.of(JANUARY, FEBRUARY));

        // Then
        assertEquals(FEBRUARY, comparison.getBestPerformingCohort());
        assertEquals(JANUARY, comparison.getWorstPerformingCohort());
        assertEquals(RetentionTrend.IMPROVING, comparison.getRetentionTrend());
        assertEquals(7.5, comparison.getRetentionVolatility());
    }

    @Test
    void testCompareCohortsRetention_EmptyListRejected() {
        assertThrows(AnalyticsValidationException.class,
                () -> cohortAnalyzer.compareCohortsRetention(TENANT, Collections.emptyList()));
    }

    @Test
    void testPredictFutureRetention_NeedsThreeMonths() {
        // Given
        stubCohort(JANUARY, 100.0, 60.0);

        // When / Then
        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> cohortAnalyzer.predictFutureRetention(TENANT, JANUARY, 3));
        assertEquals(3, ex.getRequired());
        assertEquals(2, ex.getActual());
    }

    @Test
    void testPredictFutureRetention_DecaysFromLastObservation() {
        // Given
        stubCohort(JANUARY, 100.0, 60.0, 45.0, 40.0, 35.0, 30.0);

        // When
        RetentionPrediction prediction = cohortAnalyzer.predictFutureRetention(TENANT, JANUARY, 3);

        // Then
        assertEquals(3, prediction.getPredictions().size());
        assertEquals(6, prediction.getPredictions().get(0).getMonthNumber());
        assertEquals(Confidence.HIGH, prediction.getConfidence());
        double first = prediction.getPredictions().get(0).getPredictedRetention();
        double second = prediction.getPredictions().get(1).getPredictedRetention();
        assertTrue(first < 30.0);
        assertTrue(second < first);
        assertEquals(12.0, prediction.getPredictions().get(0).getConfidenceWidth());
    }

    @Test
    void testPredictFutureRetention_ConfidenceWidthNeverShrinks() {
        // Given
        stubCohort(JANUARY, 100.0, 60.0, 45.0, 40.0, 35.0, 30.0);

        // When
        RetentionPrediction prediction = cohortAnalyzer.predictFutureRetention(TENANT, JANUARY, 12);

        // Then
        List<RetentionPrediction.PredictedRetention> predictions = prediction.getPredictions();
        assertEquals(12, predictions.size());
        for (int i = 0; i < predictions.size() - 1; i++) {
            assertTrue(predictions.get(i).getConfidenceWidth() <= predictions.get(i + 1).getConfidenceWidth(),
                    "width shrank after month " + predictions.get(i).getMonthNumber());
        }
        assertEquals(28.0, predictions.get(8).getConfidenceWidth());
        assertEquals(30.0, predictions.get(9).getConfidenceWidth());
        assertEquals(30.0, predictions.get(11).getConfidenceWidth());
    }

    @Test
    void testCalculateDecayRate_SkipsZeroRates() {
        // Given
        List<Double> rates = List.of(100.0, 0.0, 50.0);

        // When / Then
        assertEquals(0.1, CohortAnalyzer.calculateDecayRate(rates));
        assertEquals(Math.log(2), CohortAnalyzer.calculateDecayRate(List.of(100.0, 50.0)), 1e-9);
    }

    @Test
    void testGetRetentionBenchmarks_BelowTargetAddsRecommendation() {
        // Given
        when(userCohortRepository.findRecentCohortMonths(eq(TENANT), any())).thenReturn(List.of(FEBRUARY));
        stubCohort(FEBRUARY, 100.0, 30.0);

        // When
        RetentionBenchmarks benchmarks = cohortAnalyzer.getRetentionBenchmarks(TENANT);

        // Then
        assertEquals(FEBRUARY, benchmarks.getCohortMonth());
        assertEquals(4, benchmarks.getCheckpoints().size());
        assertEquals(BenchmarkStatus.BELOW, benchmarks.getCheckpoints().get(0).getStatus());
        assertTrue(benchmarks.getRecommendations().get(0).contains("onboarding"));
    }

    @Test
    void testGetRetentionBenchmarks_NoCohorts() {
        // Given
        when(userCohortRepository.findRecentCohortMonths(eq(TENANT), any())).thenReturn(Collections.emptyList());

        // When / Then
        assertThrows(NotFoundException.class, () -> cohortAnalyzer.getRetentionBenchmarks(TENANT));
    }

    private void stubCohort(LocalDate cohortMonth, double... retentionRates) {
        List<UserCohortEntity> rows = new ArrayList<>();
        BigDecimal cumulative = BigDecimal.ZERO;
        for (int month = 0; month < retentionRates.length; month++) {
            BigDecimal revenue = new BigDecimal("100.00");
            cumulative = cumulative.add(revenue);
            rows.add(UserCohortEntity.builder()
                    .tenantId(TENANT)
                    .cohortMonth(cohortMonth)
                    .monthNumber(month)
                    .cohortSize(100)
                    .retainedUsers((int) retentionRates[month])
                    .retentionRate(BigDecimal.valueOf(retentionRates[month]))
                    .revenue(revenue)
                    .lifetimeValue(cumulative.divide(BigDecimal.valueOf(100)))
                    .build());
        }
        when(userCohortRepository.findByTenantIdAndCohortMonthOrderByMonthNumberAsc(TENANT, cohortMonth))
                .thenReturn(rows);
    }
}
