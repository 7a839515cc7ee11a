package com.salary.disclosure.pipeline;

/**
 * Pipeline stages in execution order.
 */
public enum PipelineStage {
    INGEST("ingest", "Consolidate raw yearly extracts"),
    NORMALIZE_EMPLOYERS("normalize_employers", "Canonicalize employer names"),
    NORMALIZE_JOBS("normalize_jobs", "Standardize job titles and infer families"),
    LINK_PERSONS("link_persons", "Link individuals across years"),
    VALIDATE("validate", "Run data quality checks"),
    ANALYTICS_BASIC("analytics_basic", "Year summaries and top earners"),
    ANALYTICS_COMPLEX("analytics_complex", "Employer and job cohort metrics"),
    ANALYTICS_SECTOR("analytics_sector", "Sector-level analytics"),
    SEARCH_INDEX("search_index", "Employer and job search index");

    private final String id;
    private final String description;

    PipelineStage(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }
}
