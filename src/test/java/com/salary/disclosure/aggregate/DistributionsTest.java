package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.Percentile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distributions Tests")
class DistributionsTest {

    private static final double EPSILON = 1e-9;

    @ParameterizedTest
    @DisplayName("Linear interpolation between closest ranks")
    @CsvSource({
            "0.0,  1.0",
            "0.5,  2.5",
            "0.75, 3.25",
            "0.9,  3.7",
            "1.0,  4.0"
    })
    void testQuantile(double probability, double expected) {
        assertEquals(expected, Distributions.quantile(List.of(4.0, 1.0, 3.0, 2.0), probability), EPSILON);
    }

    @Test
    @DisplayName("Single value is every quantile")
    void testSingleValue() {
        assertEquals(7.0, Distributions.quantile(List.of(7.0), 0.99), EPSILON);
    }

    @Test
    @DisplayName("Quantile of nothing is NaN")
    void testEmptyQuantile() {
        assertTrue(Double.isNaN(Distributions.median(List.of())));
    }

    @Test
    @DisplayName("Probability outside [0, 1] is rejected")
    void testInvalidProbability() {
        assertThrows(IllegalArgumentException.class, () -> Distributions.quantile(List.of(1.0), 1.5));
    }

    @Test
    @DisplayName("describe reports count, sum, mean, bounds and the requested percentiles")
    void testDescribe() {
        DistributionStats stats = Distributions.describe(List.of(100.0, 300.0, 200.0), Percentile.P50, Percentile.P90);

        assertEquals(3, stats.count());
        assertEquals(600.0, stats.sum(), EPSILON);
        assertEquals(200.0, stats.mean(), EPSILON);
        assertEquals(100.0, stats.min(), EPSILON);
        assertEquals(300.0, stats.max(), EPSILON);
        assertEquals(200.0, stats.percentiles().get(Percentile.P50), EPSILON);
        assertEquals(280.0, stats.percentiles().get(Percentile.P90), EPSILON);
        assertFalse(stats.percentiles().containsKey(Percentile.P99));
    }

    @Test
    @DisplayName("describe of nothing has zero count")
    void testDescribeEmpty() {
        DistributionStats stats = Distributions.describe(List.of(), Percentile.P50);
        assertEquals(0, stats.count());
        assertTrue(stats.percentiles().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Rounding is half-to-even on the decimal form")
    @CsvSource({
            "2.675, 2, 2.68",
            "0.125, 2, 0.12",
            "0.135, 2, 0.14",
            "1.23456, 4, 1.2346",
            "2.5, 0, 2.0"
    })
    void testRound(double value, int places, double expected) {
        assertEquals(expected, Distributions.round(value, places), EPSILON);
    }

    @Test
    @DisplayName("NaN passes through rounding")
    void testRoundNaN() {
        assertTrue(Double.isNaN(Distributions.round(Double.NaN, 2)));
    }
}
