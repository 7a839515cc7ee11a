package com.salary.disclosure.quality;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Output of {@link DataQualityValidator}: summary figures plus every issue found.
 */
public record DataQualityReport(Instant generatedAt, QualitySummary summary, List<QualityIssue> issues) {
    public DataQualityReport {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(summary, "summary is required");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /**
     * Number of issues per severity; every severity is present.
     */
    public Map<Severity, Long> issueCounts() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (QualityIssue issue : issues) {
            counts.merge(issue.severity(), 1L, Long::sum);
        }
        return counts;
    }

    public boolean hasHighSeverity() {
        return issueCounts().get(Severity.HIGH) > 0;
    }

    public List<QualityIssue> issues(String check) {
        return issues.stream()
                .filter(issue -> issue.check().equals(check))
                .collect(Collectors.toList());
    }
}
