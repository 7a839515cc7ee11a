package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.CohortMetric;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Cohort metrics grouped by key; each key holds its metrics ordered by year so a
 * caller reads one entity's full time series with a single lookup.
 */
public final class CohortMetrics {

    private final CohortGrain grain;
    private final SortedMap<String, List<CohortMetric>> series;

    public CohortMetrics(CohortGrain grain, Map<String, List<CohortMetric>> series) {
        this.grain = Objects.requireNonNull(grain, "grain is required");
        SortedMap<String, List<CohortMetric>> copy = new TreeMap<>();
        series.forEach((key, metrics) -> copy.put(key, List.copyOf(metrics)));
        this.series = Collections.unmodifiableSortedMap(copy);
    }

    public CohortGrain getGrain() {
        return grain;
    }

    /**
     * The year-ordered series for one key, empty when the key is unknown.
     */
    public List<CohortMetric> series(String key) {
        return series.getOrDefault(key, List.of());
    }

    public Optional<CohortMetric> metric(String key, int year) {
        return series(key).stream().filter(m -> m.year() == year).findFirst();
    }

    public Set<String> keys() {
        return series.keySet();
    }

    public SortedMap<String, List<CohortMetric>> asMap() {
        return series;
    }

    public int size() {
        return series.size();
    }
}
