package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.Percentile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Descriptive statistics over compensation values.
 * Quantiles interpolate linearly between the closest ranks: for probability
 * {@code p} over {@code n} sorted values the position is {@code (n - 1) * p}.
 * Infinite values sort to the ends and are returned as-is when a quantile lands on them.
 */
public final class Distributions {

    private Distributions() {
        // Utility class
    }

    public static DistributionStats describe(Collection<Double> values, Percentile... percentiles) {
        double[] sorted = sortedCopy(values);
        int n = sorted.length;
        if (n == 0) {
            return new DistributionStats(0, 0.0, Double.NaN, Double.NaN, Double.NaN, Map.of());
        }

        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        Map<Percentile, Double> quantiles = new EnumMap<>(Percentile.class);
        for (Percentile percentile : percentiles) {
            quantiles.put(percentile, quantileOfSorted(sorted, percentile.getProbability()));
        }
        return new DistributionStats(n, sum, sum / n, sorted[0], sorted[n - 1], quantiles);
    }

    /**
     * Quantile of unsorted values; NaN when there are none.
     */
    public static double quantile(Collection<Double> values, double probability) {
        return quantileOfSorted(sortedCopy(values), probability);
    }

    public static double median(Collection<Double> values) {
        return quantile(values, 0.5);
    }

    static double quantileOfSorted(double[] sorted, double probability) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be in [0, 1], got " + probability);
        }
        int n = sorted.length;
        if (n == 0) {
            return Double.NaN;
        }
        double position = (n - 1) * probability;
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, n - 1);
        double fraction = position - lower;
        if (fraction == 0.0 || sorted[lower] == sorted[upper]) {
            return sorted[lower];
        }
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /**
     * Rounds half-to-even to the given number of decimal places. NaN and infinities pass through.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static double[] sortedCopy(Collection<Double> values) {
        double[] sorted = new double[values.size()];
        int i = 0;
        for (Double value : values) {
            sorted[i++] = value;
        }
        Arrays.sort(sorted);
        return sorted;
    }
}
