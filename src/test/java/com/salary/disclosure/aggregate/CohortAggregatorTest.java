package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.CohortMetric;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.Percentile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.salary.disclosure.aggregate.FactFixtures.fact;
import static com.salary.disclosure.aggregate.FactFixtures.sectorFact;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CohortAggregator Tests")
class CohortAggregatorTest {

    private static final double EPSILON = 1e-9;

    private final CohortAggregator aggregator = new CohortAggregator();

    @Nested
    @DisplayName("Employer retention and growth")
    class EmployerMetrics {

        @Test
        @DisplayName("First dataset year reports zero retention and growth")
        void testFirstYear() {
            CohortMetrics metrics = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 100), fact(2020, 2, 7, 200)));

            CohortMetric metric = metrics.metric("7", 2020).orElseThrow();
            assertEquals(2, metric.headcount());
            assertEquals(0, metric.stayedCount());
            assertEquals(0.0, metric.retentionRate());
            assertEquals(0.0, metric.growthMedian());
            assertEquals(150.0, metric.mean(), EPSILON);
        }

        @Test
        @DisplayName("Four of ten staying gives retention 0.4 and the median of their growth")
        void testRetentionAndGrowth() {
            List<FactRecord> facts = new ArrayList<>();
            for (long person = 1; person <= 10; person++) {
                facts.add(fact(2020, person, 7, 100));
            }
            facts.add(fact(2021, 1, 7, 110));
            facts.add(fact(2021, 2, 7, 120));
            facts.add(fact(2021, 3, 7, 130));
            facts.add(fact(2021, 4, 7, 140));
            for (long person = 11; person <= 16; person++) {
                facts.add(fact(2021, person, 7, 90));
            }

            CohortMetric metric = aggregator.employerMetrics(facts).metric("7", 2021).orElseThrow();

            assertEquals(10, metric.headcount());
            assertEquals(4, metric.stayedCount());
            assertEquals(0.4, metric.retentionRate(), EPSILON);
            assertEquals(0.25, metric.growthMedian(), EPSILON);
        }

        @Test
        @DisplayName("The latest earlier year counts even across a gap")
        void testGapYear() {
            CohortMetrics metrics = aggregator.employerMetrics(List.of(
                    fact(2019, 1, 7, 100),
                    fact(2020, 2, 8, 100),
                    fact(2021, 1, 7, 150)));

            CohortMetric metric = metrics.metric("7", 2021).orElseThrow();
            assertEquals(1, metric.stayedCount());
            assertEquals(0.5, metric.growthMedian(), EPSILON);
        }

        @Test
        @DisplayName("Duplicate prior rows resolve to the last in input order")
        void testLastOccurrenceWins() {
            CohortMetric metric = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 100),
                    fact(2020, 1, 7, 200),
                    fact(2021, 1, 7, 220))).metric("7", 2021).orElseThrow();

            assertEquals(0.1, metric.growthMedian(), EPSILON);
        }

        @Test
        @DisplayName("A zero prior total counts as stayed with infinite growth")
        void testZeroPrior() {
            CohortMetric metric = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 0),
                    fact(2021, 1, 7, 120_000))).metric("7", 2021).orElseThrow();

            assertEquals(1, metric.stayedCount());
            assertEquals(1.0, metric.retentionRate(), EPSILON);
            assertEquals(Double.POSITIVE_INFINITY, metric.growthMedian());
        }

        @Test
        @DisplayName("Infinite growth from a zero prior shifts the median")
        void testZeroPriorInMedian() {
            CohortMetric metric = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 0),
                    fact(2020, 2, 7, 100),
                    fact(2020, 3, 7, 100),
                    fact(2021, 1, 7, 100_000),
                    fact(2021, 2, 7, 110),
                    fact(2021, 3, 7, 120))).metric("7", 2021).orElseThrow();

            assertEquals(3, metric.stayedCount());
            assertEquals(0.2, metric.growthMedian(), EPSILON);
        }

        @Test
        @DisplayName("Zero in both years adds no growth sample")
        void testZeroBothYears() {
            CohortMetric metric = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 0),
                    fact(2021, 1, 7, 0))).metric("7", 2021).orElseThrow();

            assertEquals(1, metric.stayedCount());
            assertEquals(0.0, metric.growthMedian());
        }

        @Test
        @DisplayName("Moving employer is not retention")
        void testMoveIsNotRetention() {
            CohortMetric metric = aggregator.employerMetrics(List.of(
                    fact(2020, 1, 7, 100),
                    fact(2021, 1, 8, 100))).metric("8", 2021).orElseThrow();

            assertEquals(0, metric.stayedCount());
            assertEquals(0.0, metric.retentionRate());
        }

        @Test
        @DisplayName("Employer percentiles are p50, p75, p90 and p99")
        void testEmployerPercentiles() {
            CohortMetric metric = aggregator.employerMetrics(List.of(fact(2020, 1, 7, 100)))
                    .metric("7", 2020).orElseThrow();
            assertEquals(List.of(Percentile.P50, Percentile.P75, Percentile.P90, Percentile.P99),
                    new ArrayList<>(metric.percentiles().keySet()));
        }
    }

    @Test
    @DisplayName("Job metrics carry no cohort fields")
    void testJobMetrics() {
        CohortMetrics metrics = aggregator.jobMetrics(List.of(
                fact(2020, 1, 7, 100), fact(2020, 2, 8, 300), fact(2021, 1, 7, 200)));

        assertEquals(CohortGrain.JOB, metrics.getGrain());
        List<CohortMetric> series = metrics.series("1");
        assertEquals(2, series.size());
        assertEquals(2020, series.get(0).year());
        assertEquals(200.0, series.get(0).percentile(Percentile.P50), EPSILON);
        assertFalse(series.get(0).hasCohortFields());
        assertThrows(IllegalArgumentException.class, () -> series.get(0).percentile(Percentile.P99));
    }

    @Test
    @DisplayName("Sector metrics merge case variants and add an overall series")
    void testSectorMetrics() {
        CohortMetrics metrics = aggregator.sectorMetrics(List.of(
                sectorFact(2020, "COLLEGES", 1, "PROFESSOR", 100),
                sectorFact(2020, "colleges", 2, "PROFESSOR", 200),
                sectorFact(2020, "Universities", 3, "PROFESSOR", 600)));

        assertEquals(2, metrics.metric("Colleges", 2020).orElseThrow().headcount());
        assertEquals(3, metrics.metric(CohortAggregator.OVERALL_KEY, 2020).orElseThrow().headcount());
        assertEquals(300.0, metrics.metric(CohortAggregator.OVERALL_KEY, 2020).orElseThrow().mean(), EPSILON);
        assertTrue(metrics.series("COLLEGES").isEmpty());
    }

    @Test
    @DisplayName("Empty input gives empty collections")
    void testEmpty() {
        assertEquals(0, aggregator.employerMetrics(List.of()).size());
        assertEquals(0, aggregator.sectorMetrics(List.of()).size());
    }

    @Test
    void testRetentionRateOfEmptyGroup() {
        assertEquals(0.0, CohortAggregator.retentionRate(0, 0));
        assertEquals(0.0, CohortAggregator.growthMedian(List.of()));
    }
}
