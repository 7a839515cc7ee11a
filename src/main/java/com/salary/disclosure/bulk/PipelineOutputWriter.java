package com.salary.disclosure.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.salary.disclosure.aggregate.BasicAnalytics;
import com.salary.disclosure.aggregate.CohortMetrics;
import com.salary.disclosure.aggregate.SectorReport;
import com.salary.disclosure.alias.AliasSuggestion;
import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.CohortMetric;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.Percentile;
import com.salary.disclosure.pipeline.PipelineResult;
import com.salary.disclosure.pipeline.SearchIndex;
import com.salary.disclosure.quality.DataQualityReport;
import com.salary.disclosure.quality.QualityIssue;
import com.salary.disclosure.quality.QualitySummary;
import com.salary.disclosure.quality.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes the artifacts of a successful run.
 *
 * <p>Layout under the output directory:</p>
 * <pre>
 * curated/fact_comp.csv
 * curated/dim_employer.csv
 * curated/dim_job.csv
 * analytics/year_summary.json
 * analytics/top_earners.json
 * analytics/employer_metrics.json
 * analytics/job_metrics.json
 * analytics/sector_metrics.json
 * analytics/sector_report.json
 * analytics/data_quality_report.json   (absent when validation was skipped)
 * analytics/search_index.json
 * analytics/pipeline_run.json
 * </pre>
 *
 * <p>JSON documents use snake_case keys; maps keep a stable key order.</p>
 */
public class PipelineOutputWriter {
    private static final Logger log = LoggerFactory.getLogger(PipelineOutputWriter.class);

    public static final String CURATED_DIR = "curated";
    public static final String ANALYTICS_DIR = "analytics";
    public static final String SUGGESTIONS_FILE = "suggested_employer_aliases.csv";

    static final List<String> FACT_COLUMNS = List.of(
            "year", "person_id", "employer_id", "job_id", "sector", "salary", "benefits", "total_comp",
            "first_name", "last_name", "employer_canonical", "job_canonical", "job_family", "match_confidence");

    private final ObjectWriter json;

    public PipelineOutputWriter() {
        this(new ObjectMapper());
    }

    public PipelineOutputWriter(ObjectMapper objectMapper) {
        this.json = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * Writes every artifact of {@code result} under {@code outputDir}.
     */
    public void write(PipelineResult result, Path outputDir) throws IOException {
        Path curated = Files.createDirectories(outputDir.resolve(CURATED_DIR));
        Path analytics = Files.createDirectories(outputDir.resolve(ANALYTICS_DIR));

        writeFacts(result.facts(), curated.resolve("fact_comp.csv"));
        writeEmployerDimension(result.employers(), curated.resolve("dim_employer.csv"));
        writeJobDimension(result.jobs(), curated.resolve("dim_job.csv"));

        writeJson(analytics.resolve("year_summary.json"), yearSummaryJson(result.yearSummary()));
        writeJson(analytics.resolve("top_earners.json"), topEarnersJson(result.topEarners()));
        writeJson(analytics.resolve("employer_metrics.json"), cohortJson(result.employerMetrics()));
        writeJson(analytics.resolve("job_metrics.json"), cohortJson(result.jobMetrics()));
        writeJson(analytics.resolve("sector_metrics.json"), cohortJson(result.sectorMetrics()));
        writeJson(analytics.resolve("sector_report.json"), sectorReportJson(result.sectorReport()));
        if (result.qualityReport() != null) {
            writeJson(analytics.resolve("data_quality_report.json"), qualityJson(result.qualityReport()));
        }
        writeJson(analytics.resolve("search_index.json"), result.searchIndex());
        writeJson(analytics.resolve("pipeline_run.json"), runJson(result));

        log.info("output.written dir={} facts={} employers={} jobs={}",
                outputDir, result.facts().size(), result.employers().size(), result.jobs().size());
    }

    public void writeFacts(List<FactRecord> facts, Path file) throws IOException {
        List<List<String>> rows = new ArrayList<>(facts.size());
        for (FactRecord fact : facts) {
            rows.add(List.of(
                    String.valueOf(fact.year()),
                    String.valueOf(fact.personId()),
                    String.valueOf(fact.employerId()),
                    String.valueOf(fact.jobId()),
                    fact.sector(),
                    amount(fact.salary()),
                    amount(fact.benefits()),
                    amount(fact.totalComp()),
                    fact.firstName(),
                    fact.lastName(),
                    fact.employerCanonical(),
                    fact.jobCanonical(),
                    nullToEmpty(fact.jobFamily()),
                    fact.matchConfidence() != null ? fact.matchConfidence().getLabel() : ""));
        }
        writeCsv(file, FACT_COLUMNS, rows);
    }

    public void writeEmployerDimension(List<CanonicalEntity> employers, Path file) throws IOException {
        List<List<String>> rows = new ArrayList<>(employers.size());
        for (CanonicalEntity employer : employers) {
            rows.add(List.of(String.valueOf(employer.id()), employer.canonicalName()));
        }
        writeCsv(file, List.of("employer_id", "employer_canonical"), rows);
    }

    public void writeJobDimension(List<CanonicalEntity> jobs, Path file) throws IOException {
        List<List<String>> rows = new ArrayList<>(jobs.size());
        for (CanonicalEntity job : jobs) {
            rows.add(List.of(String.valueOf(job.id()), job.canonicalName(), nullToEmpty(job.familyTag())));
        }
        writeCsv(file, List.of("job_id", "job_canonical", "job_family"), rows);
    }

    public void writeAliasSuggestions(List<AliasSuggestion> suggestions, Path file) throws IOException {
        List<List<String>> rows = new ArrayList<>(suggestions.size());
        for (AliasSuggestion suggestion : suggestions) {
            rows.add(List.of(suggestion.raw(), suggestion.canonical(), suggestion.reason()));
        }
        writeCsv(file, List.of("raw", "canonical", "reason"), rows);
        log.info("output.suggestions file={} count={}", file, suggestions.size());
    }

    static Object yearSummaryJson(List<BasicAnalytics.YearSummary> summaries) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (BasicAnalytics.YearSummary summary : summaries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("year", summary.year());
            row.put("count", summary.count());
            row.put("mean", summary.mean());
            summary.percentiles().forEach((p, value) -> row.put(p.getLabel(), value));
            rows.add(row);
        }
        return rows;
    }

    static Object topEarnersJson(Map<Integer, List<BasicAnalytics.TopEarner>> topEarners) {
        Map<String, Object> byYear = new LinkedHashMap<>();
        topEarners.forEach((year, earners) -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (BasicAnalytics.TopEarner earner : earners) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("rank", earner.rank());
                row.put("person_id", earner.personId());
                row.put("first_name", earner.firstName());
                row.put("last_name", earner.lastName());
                row.put("employer_canonical", earner.employerCanonical());
                row.put("job_canonical", earner.jobCanonical());
                row.put("total_comp", earner.totalComp());
                row.put("salary", earner.salary());
                row.put("benefits", earner.benefits());
                rows.add(row);
            }
            byYear.put(String.valueOf(year), rows);
        });
        return byYear;
    }

    static Object cohortJson(CohortMetrics metrics) {
        Map<String, Object> byKey = new LinkedHashMap<>();
        metrics.asMap().forEach((key, series) -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CohortMetric metric : series) {
                rows.add(cohortRow(metric));
            }
            byKey.put(key, rows);
        });
        return byKey;
    }

    static Map<String, Object> cohortRow(CohortMetric metric) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("year", metric.year());
        row.put("headcount", metric.headcount());
        row.put("mean", metric.mean());
        for (Map.Entry<Percentile, Double> entry : metric.percentiles().entrySet()) {
            row.put(entry.getKey().getLabel(), entry.getValue());
        }
        if (metric.hasCohortFields()) {
            row.put("stayed_count", metric.stayedCount());
            row.put("retention_rate", metric.retentionRate());
            row.put("growth_median", finiteOrNull(metric.growthMedian()));
        }
        return row;
    }

    static Object sectorReportJson(SectorReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        report.sectors().forEach((name, profile) -> {
            Map<String, Object> years = new LinkedHashMap<>();
            profile.years().forEach((year, y) -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("headcount", y.headcount());
                row.put("total_payroll", y.totalPayroll());
                row.put("mean_pay", y.meanPay());
                row.put("median_pay", y.medianPay());
                row.put("p75", y.p75());
                row.put("p90", y.p90());
                row.put("p99", y.p99());
                row.put("min_pay", y.minPay());
                row.put("max_pay", y.maxPay());
                row.put("unique_employers", y.uniqueEmployers());
                row.put("yoy_headcount_growth", y.yoyHeadcountGrowth());
                row.put("yoy_pay_growth", y.yoyPayGrowth());
                years.put(String.valueOf(year), row);
            });
            Map<String, Object> sector = new LinkedHashMap<>();
            sector.put("years", years);
            sector.put("top_job_titles", profile.topJobTitles());
            root.put(name, sector);
        });

        Map<String, Object> overall = new LinkedHashMap<>();
        report.overall().forEach((year, o) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("headcount", o.headcount());
            row.put("total_payroll", o.totalPayroll());
            row.put("mean_pay", o.meanPay());
            row.put("median_pay", o.medianPay());
            overall.put(String.valueOf(year), row);
        });
        root.put("_overall", overall);
        return root;
    }

    static Object qualityJson(DataQualityReport report) {
        QualitySummary summary = report.summary();
        Map<String, Object> summaryJson = new LinkedHashMap<>();
        summaryJson.put("total_records", summary.totalRecords());
        summaryJson.put("year_range", summary.firstYear() == null
                ? List.of()
                : List.of(summary.firstYear(), summary.lastYear()));
        summaryJson.put("unique_employers", summary.uniqueEmployers());
        summaryJson.put("unique_persons", summary.uniquePersons());
        summaryJson.put("unique_job_titles", summary.uniqueJobTitles());
        summaryJson.put("total_compensation_sum", summary.totalCompensationSum());
        summaryJson.put("mean_compensation", summary.meanCompensation());
        summaryJson.put("median_compensation", summary.medianCompensation());

        Map<String, Object> counts = new LinkedHashMap<>();
        report.issueCounts().forEach((severity, count) -> counts.put(severity.getLabel(), count));

        List<Map<String, Object>> issues = new ArrayList<>();
        for (QualityIssue issue : report.issues()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("check", issue.check());
            row.put("count", issue.count());
            row.put("severity", issue.severity().getLabel());
            row.putAll(issue.details());
            issues.add(row);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generated_at", report.generatedAt().toString());
        root.put("summary", summaryJson);
        root.put("issue_counts", counts);
        root.put("issues", issues);
        return root;
    }

    static Object runJson(PipelineResult result) {
        Map<String, Object> stages = new LinkedHashMap<>();
        result.stageDurations().forEach((stage, duration) -> stages.put(stage.getId(), duration.toMillis()));

        List<Map<String, Object>> rejected = new ArrayList<>();
        if (result.ingest() != null) {
            result.ingest().rejected().forEach(r -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("input", r.inputName());
                row.put("reason", r.reason());
                rejected.add(row);
            });
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("run_id", result.runId());
        root.put("records", result.facts().size());
        root.put("persons", result.linkage().chainCount());
        root.put("employers", result.employers().size());
        root.put("jobs", result.jobs().size());
        root.put("malformed_values", result.ingest() != null ? result.ingest().malformedValues() : 0L);
        root.put("rejected_inputs", rejected);
        root.put("stage_duration_ms", stages);
        root.put("high_severity_issues", result.quality()
                .map(q -> q.issueCounts().get(Severity.HIGH))
                .orElse(0L));
        return root;
    }

    private void writeJson(Path file, Object value) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            json.writeValue(writer, value);
        }
        log.debug("output.json file={}", file);
    }

    private static void writeCsv(Path file, List<String> header, List<List<String>> rows) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(CsvCodec.joinRow(header));
            writer.newLine();
            for (List<String> row : rows) {
                writer.write(CsvCodec.joinRow(row));
                writer.newLine();
            }
        }
    }

    /**
     * Plain decimal text with at least one fractional digit, never exponent notation.
     */
    static String amount(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (decimal.scale() < 1) {
            decimal = decimal.setScale(1);
        }
        return decimal.toPlainString();
    }

    // JSON has no literal for infinities; they are written as null
    private static Double finiteOrNull(Double value) {
        return value == null || Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
