package com.salary.disclosure.quality;

/**
 * Limits used by the compensation and headcount checks.
 *
 * @param highCompThreshold   totals above this are reported as {@code high_salary}
 * @param disclosureThreshold positive totals below this are reported as {@code below_threshold}
 * @param headcountDropMin    minimum prior-year headcount for an employer drop to count
 */
public record QualityThresholds(double highCompThreshold, double disclosureThreshold, int headcountDropMin) {

    public static final double DEFAULT_HIGH_COMP = 2_000_000;
    public static final double DEFAULT_DISCLOSURE = 100_000;
    public static final int DEFAULT_HEADCOUNT_DROP_MIN = 50;

    public QualityThresholds {
        if (highCompThreshold <= 0) {
            throw new IllegalArgumentException("highCompThreshold must be > 0");
        }
        if (disclosureThreshold < 0) {
            throw new IllegalArgumentException("disclosureThreshold must be >= 0");
        }
        if (headcountDropMin < 1) {
            throw new IllegalArgumentException("headcountDropMin must be >= 1");
        }
    }

    public static QualityThresholds defaults() {
        return new QualityThresholds(DEFAULT_HIGH_COMP, DEFAULT_DISCLOSURE, DEFAULT_HEADCOUNT_DROP_MIN);
    }
}
