package com.salary.disclosure.aggregate;

/**
 * Grouping key of a cohort metric collection.
 */
public enum CohortGrain {
    EMPLOYER,
    JOB,
    SECTOR
}
