package com.salary.disclosure.pipeline;

import com.salary.disclosure.aggregate.BasicAnalytics;
import com.salary.disclosure.aggregate.CohortAggregator;
import com.salary.disclosure.aggregate.CohortMetrics;
import com.salary.disclosure.aggregate.SectorAnalytics;
import com.salary.disclosure.aggregate.SectorReport;
import com.salary.disclosure.alias.AliasSuggestion;
import com.salary.disclosure.alias.AliasSuggestionGenerator;
import com.salary.disclosure.alias.AliasTableLoader;
import com.salary.disclosure.cache.ResolutionCache;
import com.salary.disclosure.config.PipelineConfig;
import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.RawRecord;
import com.salary.disclosure.ingest.IngestResult;
import com.salary.disclosure.ingest.IngestService;
import com.salary.disclosure.linkage.FactAssembler;
import com.salary.disclosure.linkage.LinkageResult;
import com.salary.disclosure.logging.LogContext;
import com.salary.disclosure.metrics.NoOpPipelineMetrics;
import com.salary.disclosure.metrics.PipelineMetrics;
import com.salary.disclosure.quality.DataQualityReport;
import com.salary.disclosure.quality.DataQualityValidator;
import com.salary.disclosure.registry.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Runs the stages of {@link PipelineStage} in order and collects every artifact in a
 * {@link PipelineResult}.
 *
 * <p>Each stage is timed and logged under the run's {@link LogContext}. Any exception
 * raised by a stage aborts the run with a {@link PipelineException}; nothing is
 * written by this class, so a failed run publishes nothing.</p>
 *
 * <pre>
 * PipelineResult result = new SalaryPipeline(config).run();
 * new PipelineOutputWriter().write(result, config.getOutputDir());
 * </pre>
 */
public class SalaryPipeline {
    private static final Logger log = LoggerFactory.getLogger(SalaryPipeline.class);

    private final PipelineConfig config;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final AliasTableLoader aliasLoader = new AliasTableLoader();

    public SalaryPipeline(PipelineConfig config) {
        this(config, new NoOpPipelineMetrics(), Clock.systemUTC());
    }

    public SalaryPipeline(PipelineConfig config, PipelineMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = metrics != null ? metrics : new NoOpPipelineMetrics();
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Executes every stage.
     *
     * @throws PipelineException when any stage fails
     */
    public PipelineResult run() {
        String runId = LogContext.generateRunId();
        Map<PipelineStage, Duration> durations = new EnumMap<>(PipelineStage.class);

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("pipeline.started runId={} config={}", runId, config);
            ResolutionCache cache = ResolutionCache.create(config.getCacheConfig());
            FactAssembler assembler = new FactAssembler();

            IngestResult ingest = runStage(runId, PipelineStage.INGEST, durations, this::ingest);
            List<RawRecord> records = ingest.records();

            Resolution employers = runStage(runId, PipelineStage.NORMALIZE_EMPLOYERS, durations, () -> {
                EntityResolver resolver = EntityResolver.employers(
                        aliasLoader.load(config.getEmployerAliases()), cache, metrics);
                return new Resolution(resolver, assembler.resolve(resolver, records));
            });

            Resolution jobs = runStage(runId, PipelineStage.NORMALIZE_JOBS, durations, () -> {
                EntityResolver resolver = EntityResolver.jobs(aliasLoader.load(config.getJobAliases()), cache, metrics);
                return new Resolution(resolver, assembler.resolve(resolver, records));
            });

            LinkageResult linkage = runStage(runId, PipelineStage.LINK_PERSONS, durations, () -> {
                LinkageResult result = assembler.link(records, employers.entities(), jobs.entities());
                metrics.incrementChainsCreated(result.chainCount());
                return result;
            });
            List<FactRecord> facts = linkage.facts();

            DataQualityReport quality = null;
            if (config.isSkipValidation()) {
                log.info("stage.skipped stage={}", PipelineStage.VALIDATE.getId());
            } else {
                quality = runStage(runId, PipelineStage.VALIDATE, durations, () ->
                        new DataQualityValidator(config.getQualityThresholds(), clock).validate(facts));
            }

            BasicAnalytics basic = new BasicAnalytics();
            BasicOutputs basicOutputs = runStage(runId, PipelineStage.ANALYTICS_BASIC, durations, () ->
                    new BasicOutputs(basic.yearSummary(facts), basic.topEarners(facts, config.getTopEarnersLimit())));

            CohortAggregator aggregator = new CohortAggregator();
            CohortOutputs cohorts = runStage(runId, PipelineStage.ANALYTICS_COMPLEX, durations, () ->
                    new CohortOutputs(aggregator.employerMetrics(facts), aggregator.jobMetrics(facts)));

            SectorOutputs sectors = runStage(runId, PipelineStage.ANALYTICS_SECTOR, durations, () ->
                    new SectorOutputs(aggregator.sectorMetrics(facts), new SectorAnalytics().sectorReport(facts)));

            SearchIndex searchIndex = runStage(runId, PipelineStage.SEARCH_INDEX, durations, () ->
                    SearchIndex.from(employers.dimension(), jobs.dimension()));

            PipelineResult result = new PipelineResult(runId, ingest, employers.dimension(), jobs.dimension(),
                    linkage, quality, basicOutputs.yearSummary(), basicOutputs.topEarners(),
                    cohorts.employers(), cohorts.jobs(), sectors.metrics(), sectors.report(),
                    searchIndex, durations);
            log.info("pipeline.completed runId={} facts={} persons={} cacheStats={}",
                    runId, facts.size(), linkage.chainCount(), cache.getStats());
            return result;
        }
    }

    /**
     * Ingests the raw directory and proposes employer aliases from the raw employer strings.
     *
     * @throws PipelineException when ingest fails
     */
    public List<AliasSuggestion> suggestAliases() {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId)) {
            IngestResult ingest = runStage(runId, PipelineStage.INGEST, new EnumMap<>(PipelineStage.class),
                    this::ingest);
            List<String> rawEmployers = new ArrayList<>(ingest.records().size());
            for (RawRecord record : ingest.records()) {
                rawEmployers.add(record.employerRaw());
            }
            return new AliasSuggestionGenerator().suggest(rawEmployers);
        }
    }

    private IngestResult ingest() throws Exception {
        return new IngestService(config.getRawDir(), metrics).ingest();
    }

    <T> T runStage(String runId, PipelineStage stage, Map<PipelineStage, Duration> durations, StageTask<T> task) {
        try (LogContext ctx = LogContext.forStage(runId, stage.getId())) {
            log.info("stage.started stage={} description='{}'", stage.getId(), stage.getDescription());
            long start = System.nanoTime();
            T result;
            try {
                result = task.run();
            } catch (Exception e) {
                log.error("stage.failed stage={} error={}", stage.getId(), e.getMessage(), e);
                throw new PipelineException(stage, String.valueOf(e.getMessage()), e);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            durations.put(stage, elapsed);
            metrics.recordStageDuration(stage, elapsed);
            log.info("stage.completed stage={} elapsedMs={}", stage.getId(), elapsed.toMillis());
            return result;
        }
    }

    /**
     * Work of one stage.
     */
    @FunctionalInterface
    interface StageTask<T> {
        T run() throws Exception;
    }

    /**
     * Per-record entities, index-aligned with the ingested records, plus the resolver holding the dimension.
     */
    private record Resolution(EntityResolver resolver, List<CanonicalEntity> entities) {
        List<CanonicalEntity> dimension() {
            return resolver.entities();
        }
    }

    private record BasicOutputs(List<BasicAnalytics.YearSummary> yearSummary,
                                SortedMap<Integer, List<BasicAnalytics.TopEarner>> topEarners) {}

    private record CohortOutputs(CohortMetrics employers, CohortMetrics jobs) {}

    private record SectorOutputs(CohortMetrics metrics, SectorReport report) {}
}
