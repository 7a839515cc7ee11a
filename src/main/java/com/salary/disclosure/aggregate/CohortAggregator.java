package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.CohortMetric;
import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Computes per-key, per-year cohort metrics from the linked fact stream.
 *
 * <h2>Employer retention and growth</h2>
 * <p>Years are processed in ascending order. For year Y the prior population holds,
 * for every (person, employer) pair seen before Y, the record from the pair's most
 * recent earlier year; when that year has several rows for the pair the last one in
 * input order wins. A current-year record "stayed" when its pair is in the prior
 * population.</p>
 * <ul>
 *   <li>{@code retention_rate = stayed / headcount}</li>
 *   <li>{@code growth = (current - prior) / prior} per matched record;
 *       {@code growth_median} is the median, or 0.0 when nothing matched.
 *       A zero prior total gives infinite growth, which stays in the sample; only a
 *       pair that is zero in both years is skipped.</li>
 *   <li>In the first year of the dataset every employer reports 0 for both.</li>
 * </ul>
 */
public class CohortAggregator {
    private static final Logger log = LoggerFactory.getLogger(CohortAggregator.class);

    public static final String OVERALL_KEY = "_overall";

    static final Percentile[] EMPLOYER_PERCENTILES = {
            Percentile.P50, Percentile.P75, Percentile.P90, Percentile.P99};
    static final Percentile[] JOB_PERCENTILES = {
            Percentile.P50, Percentile.P75, Percentile.P90};
    static final Percentile[] SECTOR_PERCENTILES = {
            Percentile.P50, Percentile.P75, Percentile.P90, Percentile.P99};

    /**
     * Employer x year distribution plus backward-looking retention and growth.
     */
    public CohortMetrics employerMetrics(List<FactRecord> facts) {
        SortedMap<Integer, List<FactRecord>> byYear = groupByYear(facts);
        Map<PersonEmployer, FactRecord> prior = new HashMap<>();
        Map<String, List<CohortMetric>> series = new HashMap<>();
        boolean firstYear = true;

        for (Map.Entry<Integer, List<FactRecord>> yearEntry : byYear.entrySet()) {
            int year = yearEntry.getKey();
            List<FactRecord> current = yearEntry.getValue();

            for (Map.Entry<Long, List<FactRecord>> employerEntry : groupBy(current, FactRecord::employerId).entrySet()) {
                List<FactRecord> group = employerEntry.getValue();
                String key = String.valueOf(employerEntry.getKey());
                CohortMetric metric = CohortMetric.distribution(key, year, describe(group, EMPLOYER_PERCENTILES));
                metric = firstYear ? metric.withCohort(0, 0.0, 0.0) : withRetention(metric, group, prior);
                series.computeIfAbsent(key, k -> new ArrayList<>()).add(metric);
            }

            // Every prior pair is from an earlier year, so this year's rows always replace
            for (FactRecord fact : current) {
                prior.put(new PersonEmployer(fact.personId(), fact.employerId()), fact);
            }
            firstYear = false;
            log.debug("cohort.year year={} rows={} priorPairs={}", year, current.size(), prior.size());
        }

        log.info("cohort.employers keys={} years={}", series.size(), byYear.size());
        return new CohortMetrics(CohortGrain.EMPLOYER, series);
    }

    /**
     * Job x year distribution only.
     */
    public CohortMetrics jobMetrics(List<FactRecord> facts) {
        CohortMetrics metrics = distributionMetrics(CohortGrain.JOB, facts,
                fact -> String.valueOf(fact.jobId()), JOB_PERCENTILES);
        log.info("cohort.jobs keys={}", metrics.size());
        return metrics;
    }

    /**
     * Sector x year distribution (sector names title-cased), plus the all-sectors
     * series under {@value #OVERALL_KEY}.
     */
    public CohortMetrics sectorMetrics(List<FactRecord> facts) {
        Map<String, List<CohortMetric>> series = new HashMap<>(distributionMetrics(CohortGrain.SECTOR, facts,
                fact -> SectorNames.titleCase(fact.sector()), SECTOR_PERCENTILES).asMap());
        List<CohortMetric> overall = new ArrayList<>();
        groupByYear(facts).forEach((year, group) ->
                overall.add(CohortMetric.distribution(OVERALL_KEY, year, describe(group, SECTOR_PERCENTILES))));
        if (!overall.isEmpty()) {
            series.put(OVERALL_KEY, overall);
        }
        return new CohortMetrics(CohortGrain.SECTOR, series);
    }

    /**
     * Retention arithmetic for one employer-year against the prior population.
     */
    static CohortMetric withRetention(CohortMetric metric, List<FactRecord> group,
                                      Map<PersonEmployer, FactRecord> prior) {
        int stayed = 0;
        List<Double> growth = new ArrayList<>();
        for (FactRecord fact : group) {
            FactRecord previous = prior.get(new PersonEmployer(fact.personId(), fact.employerId()));
            if (previous == null) {
                continue;
            }
            stayed++;
            double change = (fact.totalComp() - previous.totalComp()) / previous.totalComp();
            if (!Double.isNaN(change)) {
                growth.add(change);
            }
        }
        return metric.withCohort(stayed, retentionRate(stayed, group.size()), growthMedian(growth));
    }

    public static double retentionRate(int stayed, int headcount) {
        return headcount == 0 ? 0.0 : (double) stayed / headcount;
    }

    public static double growthMedian(List<Double> growth) {
        if (growth.isEmpty()) {
            return 0.0;
        }
        double median = Distributions.median(growth);
        return Double.isNaN(median) ? 0.0 : median;
    }

    private CohortMetrics distributionMetrics(CohortGrain grain, List<FactRecord> facts,
                                              Function<FactRecord, String> keyFunction,
                                              Percentile[] percentiles) {
        Map<String, List<CohortMetric>> series = new HashMap<>();
        groupByYear(facts).forEach((year, yearFacts) ->
                groupBy(yearFacts, keyFunction).forEach((key, group) ->
                        series.computeIfAbsent(key, k -> new ArrayList<>())
                                .add(CohortMetric.distribution(key, year, describe(group, percentiles)))));
        return new CohortMetrics(grain, series);
    }

    static DistributionStats describe(List<FactRecord> group, Percentile... percentiles) {
        List<Double> totals = new ArrayList<>(group.size());
        for (FactRecord fact : group) {
            totals.add(fact.totalComp());
        }
        return Distributions.describe(totals, percentiles);
    }

    static SortedMap<Integer, List<FactRecord>> groupByYear(List<FactRecord> facts) {
        return groupBy(facts, FactRecord::year);
    }

    /**
     * Groups in key order; each group keeps input order.
     */
    static <K extends Comparable<K>> SortedMap<K, List<FactRecord>> groupBy(List<FactRecord> facts,
                                                                           Function<FactRecord, K> keyFunction) {
        SortedMap<K, List<FactRecord>> groups = new TreeMap<>();
        for (FactRecord fact : facts) {
            groups.computeIfAbsent(keyFunction.apply(fact), k -> new ArrayList<>()).add(fact);
        }
        return groups;
    }

    record PersonEmployer(long personId, long employerId) {}
}
