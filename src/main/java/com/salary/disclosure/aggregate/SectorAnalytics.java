package com.salary.disclosure.aggregate;

import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the {@link SectorReport} from the fact stream.
 */
public class SectorAnalytics {
    private static final Logger log = LoggerFactory.getLogger(SectorAnalytics.class);

    static final int TOP_JOB_TITLES = 10;

    public SectorReport sectorReport(List<FactRecord> facts) {
        SortedMap<String, List<FactRecord>> bySector = CohortAggregator.groupBy(facts,
                fact -> SectorNames.titleCase(fact.sector()));

        SortedMap<String, SectorReport.SectorProfile> sectors = new TreeMap<>();
        bySector.forEach((sector, sectorFacts) ->
                sectors.put(sector, profile(sector, sectorFacts)));

        SortedMap<Integer, SectorReport.OverallYear> overall = new TreeMap<>();
        CohortAggregator.groupByYear(facts).forEach((year, group) -> {
            DistributionStats stats = CohortAggregator.describe(group, Percentile.P50);
            overall.put(year, new SectorReport.OverallYear(year, stats.count(),
                    Distributions.round(stats.sum(), 2),
                    Distributions.round(stats.mean(), 2),
                    Distributions.round(stats.percentiles().get(Percentile.P50), 2)));
        });

        log.info("sectors.completed sectors={} years={}", sectors.size(), overall.size());
        return new SectorReport(sectors, overall);
    }

    private SectorReport.SectorProfile profile(String sector, List<FactRecord> sectorFacts) {
        SortedMap<Integer, SectorReport.SectorYear> years = new TreeMap<>();
        Integer previousHeadcount = null;
        Double previousMean = null;

        for (Map.Entry<Integer, List<FactRecord>> entry : CohortAggregator.groupByYear(sectorFacts).entrySet()) {
            int year = entry.getKey();
            List<FactRecord> group = entry.getValue();
            DistributionStats stats = CohortAggregator.describe(group, CohortAggregator.SECTOR_PERCENTILES);
            Set<Long> employers = new HashSet<>();
            for (FactRecord fact : group) {
                employers.add(fact.employerId());
            }

            years.put(year, new SectorReport.SectorYear(
                    year,
                    stats.count(),
                    Distributions.round(stats.sum(), 2),
                    Distributions.round(stats.mean(), 2),
                    Distributions.round(stats.percentiles().get(Percentile.P50), 2),
                    Distributions.round(stats.percentiles().get(Percentile.P75), 2),
                    Distributions.round(stats.percentiles().get(Percentile.P90), 2),
                    Distributions.round(stats.percentiles().get(Percentile.P99), 2),
                    Distributions.round(stats.min(), 2),
                    Distributions.round(stats.max(), 2),
                    employers.size(),
                    Distributions.round(relativeChange(stats.count(), previousHeadcount), 4),
                    Distributions.round(relativeChange(stats.mean(), previousMean), 4)));

            previousHeadcount = stats.count();
            previousMean = stats.mean();
        }

        return new SectorReport.SectorProfile(sector, years, topJobTitles(sectorFacts));
    }

    /**
     * Most frequent canonical job titles; equal counts order by title.
     */
    static List<String> topJobTitles(List<FactRecord> sectorFacts) {
        Map<String, Long> counts = new HashMap<>();
        for (FactRecord fact : sectorFacts) {
            counts.merge(fact.jobCanonical(), 1L, Long::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_JOB_TITLES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    static double relativeChange(double current, Number previous) {
        if (previous == null || previous.doubleValue() == 0.0) {
            return 0.0;
        }
        return (current - previous.doubleValue()) / previous.doubleValue();
    }
}
