package com.salary.disclosure.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A raw record paired with its canonical employer and job, ready for person linkage.
 */
public record ResolvedRecord(RawRecord raw, CanonicalEntity employer, CanonicalEntity job) {

    public ResolvedRecord {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(employer, "employer is required");
        Objects.requireNonNull(job, "job is required");
    }

    /**
     * Upper-cased, trimmed "first last" key. Records are only ever linked within one key.
     */
    public String nameKey() {
        return (raw.firstName() + " " + raw.lastName()).toUpperCase(Locale.ROOT).trim();
    }
}
