package com.salary.disclosure.core.model;

import java.util.Objects;

/**
 * Fully resolved, denormalized observation of one person's compensation
 * in one year at one employer and job. Immutable once built.
 */
public record FactRecord(
        int year,
        long personId,
        long employerId,
        long jobId,
        String sector,
        double salary,
        double benefits,
        double totalComp,
        String firstName,
        String lastName,
        String employerCanonical,
        String jobCanonical,
        String jobFamily,
        MatchConfidence matchConfidence
) {
    public FactRecord {
        Objects.requireNonNull(sector, "sector is required");
        Objects.requireNonNull(firstName, "firstName is required");
        Objects.requireNonNull(lastName, "lastName is required");
        Objects.requireNonNull(employerCanonical, "employerCanonical is required");
        Objects.requireNonNull(jobCanonical, "jobCanonical is required");
    }

    /**
     * Builds the fact for a resolved record once its person id is known.
     */
    public static FactRecord of(ResolvedRecord resolved, long personId) {
        RawRecord raw = resolved.raw();
        return builder()
                .year(raw.year())
                .personId(personId)
                .employerId(resolved.employer().id())
                .jobId(resolved.job().id())
                .sector(raw.sector())
                .salary(raw.salary())
                .benefits(raw.benefits())
                .totalComp(raw.totalComp())
                .firstName(raw.firstName())
                .lastName(raw.lastName())
                .employerCanonical(resolved.employer().canonicalName())
                .jobCanonical(resolved.job().canonicalName())
                .jobFamily(resolved.job().familyTag())
                .matchConfidence(MatchConfidence.HIGH)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int year;
        private long personId;
        private long employerId;
        private long jobId;
        private String sector = "";
        private double salary;
        private double benefits;
        private Double totalComp;
        private String firstName = "";
        private String lastName = "";
        private String employerCanonical = "";
        private String jobCanonical = "";
        private String jobFamily;
        private MatchConfidence matchConfidence = MatchConfidence.HIGH;

        public Builder year(int year) {
            this.year = year;
            return this;
        }

        public Builder personId(long personId) {
            this.personId = personId;
            return this;
        }

        public Builder employerId(long employerId) {
            this.employerId = employerId;
            return this;
        }

        public Builder jobId(long jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder sector(String sector) {
            this.sector = sector;
            return this;
        }

        public Builder salary(double salary) {
            this.salary = salary;
            return this;
        }

        public Builder benefits(double benefits) {
            this.benefits = benefits;
            return this;
        }

        /**
         * Overrides the total; defaults to salary + benefits.
         */
        public Builder totalComp(double totalComp) {
            this.totalComp = totalComp;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder employerCanonical(String employerCanonical) {
            this.employerCanonical = employerCanonical;
            return this;
        }

        public Builder jobCanonical(String jobCanonical) {
            this.jobCanonical = jobCanonical;
            return this;
        }

        public Builder jobFamily(String jobFamily) {
            this.jobFamily = jobFamily;
            return this;
        }

        public Builder matchConfidence(MatchConfidence matchConfidence) {
            this.matchConfidence = matchConfidence;
            return this;
        }

        public FactRecord build() {
            double total = totalComp != null ? totalComp : salary + benefits;
            return new FactRecord(year, personId, employerId, jobId, sector, salary, benefits, total,
                    firstName, lastName, employerCanonical, jobCanonical, jobFamily, matchConfidence);
        }
    }
}
