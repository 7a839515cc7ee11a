package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Whole-population year summaries and per-year top earners.
 */
public class BasicAnalytics {
    private static final Logger log = LoggerFactory.getLogger(BasicAnalytics.class);

    public static final int DEFAULT_TOP_EARNERS = 100;

    private static final Percentile[] SUMMARY_PERCENTILES = Percentile.values();

    /**
     * @param year        disclosure year
     * @param count       number of rows
     * @param mean        mean total compensation
     * @param percentiles p50, p75, p90, p95 and p99 of total compensation
     */
    public record YearSummary(int year, int count, double mean, Map<Percentile, Double> percentiles) {}

    public record TopEarner(
            int rank,
            long personId,
            String firstName,
            String lastName,
            String employerCanonical,
            String jobCanonical,
            double totalComp,
            double salary,
            double benefits
    ) {}

    public List<YearSummary> yearSummary(List<FactRecord> facts) {
        List<YearSummary> summaries = new ArrayList<>();
        CohortAggregator.groupByYear(facts).forEach((year, group) -> {
            DistributionStats stats = CohortAggregator.describe(group, SUMMARY_PERCENTILES);
            summaries.add(new YearSummary(year, stats.count(), stats.mean(), stats.percentiles()));
        });
        log.info("summary.completed years={}", summaries.size());
        return summaries;
    }

    /**
     * The {@code limit} highest total compensations per year, ranked from 1.
     * Equal totals keep their order in the fact stream.
     */
    public SortedMap<Integer, List<TopEarner>> topEarners(List<FactRecord> facts, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        SortedMap<Integer, List<TopEarner>> result = new TreeMap<>();
        CohortAggregator.groupByYear(facts).forEach((year, group) -> {
            List<FactRecord> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparingDouble(FactRecord::totalComp).reversed());
            List<TopEarner> top = new ArrayList<>();
            for (int i = 0; i < Math.min(limit, sorted.size()); i++) {
                FactRecord fact = sorted.get(i);
                top.add(new TopEarner(i + 1, fact.personId(), fact.firstName(), fact.lastName(),
                        fact.employerCanonical(), fact.jobCanonical(), fact.totalComp(),
                        fact.salary(), fact.benefits()));
            }
            result.put(year, top);
        });
        return result;
    }
}
