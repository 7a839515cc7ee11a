package com.salary.disclosure.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One categorized finding of the data-quality checks.
 *
 * @param check    check identifier, e.g. {@code exact_duplicates}
 * @param severity how serious the finding is
 * @param count    number of affected rows (or samples, for headcount drops)
 * @param details  check-specific attributes, in insertion order
 */
public record QualityIssue(String check, Severity severity, long count, Map<String, Object> details) {
    public QualityIssue {
        Objects.requireNonNull(check, "check is required");
        Objects.requireNonNull(severity, "severity is required");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public QualityIssue(String check, Severity severity, long count) {
        this(check, severity, count, Map.of());
    }
}
