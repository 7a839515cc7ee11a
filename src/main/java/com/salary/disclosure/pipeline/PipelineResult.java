package com.salary.disclosure.pipeline;

import com.salary.disclosure.aggregate.BasicAnalytics;
import com.salary.disclosure.aggregate.CohortMetrics;
import com.salary.disclosure.aggregate.SectorReport;
import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.ingest.IngestResult;
import com.salary.disclosure.linkage.LinkageResult;
import com.salary.disclosure.quality.DataQualityReport;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Every artifact of a successful run, held in memory until written.
 *
 * @param qualityReport null when validation was skipped
 */
public record PipelineResult(
        String runId,
        IngestResult ingest,
        List<CanonicalEntity> employers,
        List<CanonicalEntity> jobs,
        LinkageResult linkage,
        DataQualityReport qualityReport,
        List<BasicAnalytics.YearSummary> yearSummary,
        SortedMap<Integer, List<BasicAnalytics.TopEarner>> topEarners,
        CohortMetrics employerMetrics,
        CohortMetrics jobMetrics,
        CohortMetrics sectorMetrics,
        SectorReport sectorReport,
        SearchIndex searchIndex,
        Map<PipelineStage, Duration> stageDurations
) {
    public PipelineResult {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(linkage, "linkage is required");
        employers = List.copyOf(employers);
        jobs = List.copyOf(jobs);
        yearSummary = List.copyOf(yearSummary);
        stageDurations = stageDurations.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stageDurations));
    }

    public List<FactRecord> facts() {
        return linkage.facts();
    }

    public Optional<DataQualityReport> quality() {
        return Optional.ofNullable(qualityReport);
    }
}
