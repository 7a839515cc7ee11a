package com.salary.disclosure.aggregate;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Sector-level analytics: one profile per title-cased sector and an overall
 * per-year summary across all sectors.
 */
public record SectorReport(SortedMap<String, SectorProfile> sectors, SortedMap<Integer, OverallYear> overall) {

    public SectorReport {
        sectors = Collections.unmodifiableSortedMap(new TreeMap<>(sectors));
        overall = Collections.unmodifiableSortedMap(new TreeMap<>(overall));
    }

    /**
     * @param sector        title-cased sector name
     * @param years         year metrics in ascending year order
     * @param topJobTitles  most frequent canonical job titles, most frequent first
     */
    public record SectorProfile(String sector, SortedMap<Integer, SectorYear> years, List<String> topJobTitles) {
        public SectorProfile {
            years = Collections.unmodifiableSortedMap(new TreeMap<>(years));
            topJobTitles = List.copyOf(topJobTitles);
        }
    }

    /**
     * Money values are rounded to 2 places, growth ratios to 4.
     * Growth is relative to the sector's previous present year and 0 for its first.
     */
    public record SectorYear(
            int year,
            int headcount,
            double totalPayroll,
            double meanPay,
            double medianPay,
            double p75,
            double p90,
            double p99,
            double minPay,
            double maxPay,
            int uniqueEmployers,
            double yoyHeadcountGrowth,
            double yoyPayGrowth
    ) {}

    public record OverallYear(int year, int headcount, double totalPayroll, double meanPay, double medianPay) {}

}
