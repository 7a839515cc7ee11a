package com.salary.disclosure.pipeline;

import com.salary.disclosure.core.model.CanonicalEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookup lists for the employer and job search boxes, built from the dimension tables.
 */
public record SearchIndex(List<EmployerEntry> employers, List<JobEntry> jobs) {
    public SearchIndex {
        employers = employers != null ? List.copyOf(employers) : List.of();
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
    }

    public record EmployerEntry(long id, String name) {}

    /**
     * @param family job family label, or null when unknown
     */
    public record JobEntry(long id, String title, String family) {}

    public static SearchIndex from(List<CanonicalEntity> employerDimension, List<CanonicalEntity> jobDimension) {
        List<EmployerEntry> employers = new ArrayList<>(employerDimension.size());
        for (CanonicalEntity employer : employerDimension) {
            employers.add(new EmployerEntry(employer.id(), employer.canonicalName()));
        }
        List<JobEntry> jobs = new ArrayList<>(jobDimension.size());
        for (CanonicalEntity job : jobDimension) {
            jobs.add(new JobEntry(job.id(), job.canonicalName(), job.familyTag()));
        }
        return new SearchIndex(employers, jobs);
    }
}
