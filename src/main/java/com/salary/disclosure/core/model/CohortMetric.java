package com.salary.disclosure.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Distributional and backward-looking statistics for one grouping key in one year.
 * The cohort fields ({@code stayedCount}, {@code retentionRate}, {@code growthMedian})
 * are set for employer metrics and null for job metrics.
 */
public record CohortMetric(
        String key,
        int year,
        int headcount,
        double mean,
        Map<Percentile, Double> percentiles,
        Integer stayedCount,
        Double retentionRate,
        Double growthMedian
) {
    public CohortMetric {
        Objects.requireNonNull(key, "key is required");
        percentiles = percentiles == null || percentiles.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(percentiles));
    }

    public static CohortMetric distribution(String key, int year, DistributionStats stats) {
        return new CohortMetric(key, year, stats.count(), stats.mean(), stats.percentiles(),
                null, null, null);
    }

    public CohortMetric withCohort(int stayed, double retention, double growth) {
        return new CohortMetric(key, year, headcount, mean, percentiles, stayed, retention, growth);
    }

    public double percentile(Percentile percentile) {
        Double value = percentiles.get(percentile);
        if (value == null) {
            throw new IllegalArgumentException(percentile + " not computed for " + key);
        }
        return value;
    }

    public boolean hasCohortFields() {
        return retentionRate != null;
    }
}
