package com.salary.disclosure.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of a group of compensation values.
 */
public record DistributionStats(
        int count,
        double sum,
        double mean,
        double min,
        double max,
        Map<Percentile, Double> percentiles
) {
    public DistributionStats {
        percentiles = percentiles == null || percentiles.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(percentiles));
    }
}
