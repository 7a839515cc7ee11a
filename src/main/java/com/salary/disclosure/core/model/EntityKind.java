package com.salary.disclosure.core.model;

/**
 * Kinds of canonical entity produced by the pipeline.
 * Employers and jobs share one entity shape but are registered independently.
 */
public enum EntityKind {
    EMPLOYER("Employer"),
    JOB("Job");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
