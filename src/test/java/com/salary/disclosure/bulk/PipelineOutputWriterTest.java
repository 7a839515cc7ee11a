package com.salary.disclosure.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salary.disclosure.alias.AliasSuggestion;
import com.salary.disclosure.config.PipelineConfig;
import com.salary.disclosure.core.model.CohortMetric;
import com.salary.disclosure.core.model.DistributionStats;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.pipeline.PipelineFixtures;
import com.salary.disclosure.pipeline.PipelineResult;
import com.salary.disclosure.pipeline.SalaryPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineOutputWriter Tests")
class PipelineOutputWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PipelineOutputWriter writer = new PipelineOutputWriter(mapper);

    @TempDir
    Path workDir;

    private Path outputDir;

    @BeforeEach
    void setUp() {
        outputDir = workDir.resolve("output");
    }

    private PipelineResult run(boolean skipValidation) throws Exception {
        PipelineConfig config = PipelineConfig.builder()
                .rawDir(PipelineFixtures.writeRawDir(workDir))
                .outputDir(outputDir)
                .employerAliases(workDir.resolve("none.csv"))
                .jobAliases(workDir.resolve("none.csv"))
                .skipValidation(skipValidation)
                .build();
        return new SalaryPipeline(config).run();
    }

    private JsonNode readJson(String name) throws Exception {
        return mapper.readTree(outputDir.resolve(PipelineOutputWriter.ANALYTICS_DIR).resolve(name).toFile());
    }

    @Test
    @DisplayName("Curated tables carry their headers and one row per entity")
    void testCuratedTables() throws Exception {
        writer.write(run(false), outputDir);

        Path curated = outputDir.resolve(PipelineOutputWriter.CURATED_DIR);
        List<String> facts = Files.readAllLines(curated.resolve("fact_comp.csv"), StandardCharsets.UTF_8);
        assertEquals(String.join(",", PipelineOutputWriter.FACT_COLUMNS), facts.get(0));
        assertEquals(5, facts.size());
        assertTrue(facts.get(1).startsWith("1996,1,1350458869,"));
        assertTrue(facts.get(1).endsWith(",Jane,Doe,CITY TORONTO,NURSE,Medical,High"));

        List<String> employers = Files.readAllLines(curated.resolve("dim_employer.csv"));
        assertEquals(List.of("employer_id,employer_canonical", "1069463205,ACME", "1350458869,CITY TORONTO"),
                employers);

        List<String> jobs = Files.readAllLines(curated.resolve("dim_job.csv"));
        assertEquals("job_id,job_canonical,job_family", jobs.get(0));
        assertEquals("1011307704,NURSE,Medical", jobs.get(2));
    }

    @Test
    @DisplayName("Large amounts are written as plain decimals")
    void testLargeAmounts() throws Exception {
        FactRecord fact = FactRecord.builder()
                .year(2020)
                .personId(1)
                .employerId(7)
                .jobId(1)
                .sector("Other")
                .salary(12_450_000.5)
                .benefits(49_999.5)
                .firstName("Jane")
                .lastName("Doe")
                .employerCanonical("ACME")
                .jobCanonical("ANALYST")
                .build();
        Path file = workDir.resolve("fact_comp.csv");

        writer.writeFacts(List.of(fact), file);

        assertEquals("2020,1,7,1,Other,12450000.5,49999.5,12500000.0,Jane,Doe,ACME,ANALYST,,High",
                Files.readAllLines(file).get(1));
        assertEquals("125000.0", PipelineOutputWriter.amount(125_000));
        assertEquals("0.0", PipelineOutputWriter.amount(0));
    }

    @Test
    @DisplayName("Infinite growth median is written as null")
    void testInfiniteGrowthMedian() {
        CohortMetric metric = CohortMetric.distribution("7", 2021,
                        new DistributionStats(1, 100.0, 100.0, 100.0, 100.0, Map.of()))
                .withCohort(1, 1.0, Double.POSITIVE_INFINITY);

        Map<String, Object> row = PipelineOutputWriter.cohortRow(metric);

        assertTrue(row.containsKey("growth_median"));
        assertNull(row.get("growth_median"));
        assertEquals(1.0, row.get("retention_rate"));
    }

    @Test
    @DisplayName("Analytics documents use snake_case keys")
    void testAnalyticsJson() throws Exception {
        writer.write(run(false), outputDir);

        JsonNode summary = readJson("year_summary.json");
        assertEquals(2, summary.size());
        assertEquals(1996, summary.get(0).get("year").asInt());
        assertTrue(summary.get(0).has("p95"));

        JsonNode top = readJson("top_earners.json");
        assertEquals("Jane", top.get("1998").get(0).get("first_name").asText());
        assertEquals(1, top.get("1998").get(0).get("rank").asInt());

        JsonNode employers = readJson("employer_metrics.json");
        JsonNode acme1998 = employers.get("1069463205").get(1);
        assertEquals(1998, acme1998.get("year").asInt());
        assertEquals(1.0, acme1998.get("retention_rate").asDouble());
        assertTrue(acme1998.has("p99"));

        JsonNode jobs = readJson("job_metrics.json");
        assertFalse(jobs.get("2269922229").get(0).has("retention_rate"));
        assertFalse(jobs.get("2269922229").get(0).has("p99"));

        JsonNode sectors = readJson("sector_report.json");
        assertTrue(sectors.has("_overall"));
        assertEquals(1, sectors.get("Universities").get("years").get("1996").get("headcount").asInt());
        assertEquals("ENGINEER", sectors.get("Universities").get("top_job_titles").get(0).asText());

        assertTrue(readJson("sector_metrics.json").has("_overall"));
        assertEquals("ACME", readJson("search_index.json").get("employers").get(0).get("name").asText());
    }

    @Test
    @DisplayName("Quality and run documents")
    void testQualityAndRunJson() throws Exception {
        writer.write(run(false), outputDir);

        JsonNode quality = readJson("data_quality_report.json");
        assertEquals(4, quality.get("summary").get("total_records").asInt());
        assertEquals(1996, quality.get("summary").get("year_range").get(0).asInt());
        assertEquals(0, quality.get("issue_counts").get("high").asInt());
        assertTrue(quality.has("generated_at"));

        JsonNode run = readJson("pipeline_run.json");
        assertEquals(4, run.get("records").asInt());
        assertEquals(2, run.get("persons").asInt());
        assertEquals("2000.csv", run.get("rejected_inputs").get(0).get("input").asText());
        assertTrue(run.get("stage_duration_ms").has("link_persons"));
    }

    @Test
    @DisplayName("No quality document when validation was skipped")
    void testSkippedValidation() throws Exception {
        writer.write(run(true), outputDir);

        assertFalse(Files.exists(outputDir.resolve(PipelineOutputWriter.ANALYTICS_DIR)
                .resolve("data_quality_report.json")));
        assertTrue(Files.exists(outputDir.resolve(PipelineOutputWriter.ANALYTICS_DIR)
                .resolve("pipeline_run.json")));
    }

    @Test
    @DisplayName("Alias suggestions are written as raw, canonical, reason")
    void testAliasSuggestions() throws Exception {
        Path file = workDir.resolve("out").resolve(PipelineOutputWriter.SUGGESTIONS_FILE);
        writer.writeAliasSuggestions(List.of(
                new AliasSuggestion("Acme", "ACME INC.", "exact_normalized_match"),
                new AliasSuggestion("Beta, Ltd", "BETA LIMITED", "exact_normalized_match")), file);

        assertEquals(List.of(
                "raw,canonical,reason",
                "Acme,ACME INC.,exact_normalized_match",
                "\"Beta, Ltd\",BETA LIMITED,exact_normalized_match"), Files.readAllLines(file));
    }
}
