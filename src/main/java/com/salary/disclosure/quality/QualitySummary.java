package com.salary.disclosure.quality;

/**
 * Headline figures of the validated fact stream. Year bounds are null when there are no facts.
 */
public record QualitySummary(
        long totalRecords,
        Integer firstYear,
        Integer lastYear,
        long uniqueEmployers,
        long uniquePersons,
        long uniqueJobTitles,
        double totalCompensationSum,
        double meanCompensation,
        double medianCompensation
) {}
