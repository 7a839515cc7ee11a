package com.salary.disclosure.config;

import com.salary.disclosure.cache.CacheConfig;
import com.salary.disclosure.quality.QualityThresholds;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for one pipeline run: input and output locations, alias tables,
 * the resolution cache and the data-quality thresholds.
 *
 * <h2>Configuration keys</h2>
 * <pre>
 * salary-pipeline.raw-dir=raw
 * salary-pipeline.output-dir=output
 * salary-pipeline.employer-aliases=dictionaries/employer_aliases.csv
 * salary-pipeline.job-aliases=dictionaries/job_title_aliases.csv
 * salary-pipeline.skip-validation=false
 * salary-pipeline.top-earners.limit=100
 * salary-pipeline.cache.enabled=true
 * salary-pipeline.cache.max-size=100000
 * salary-pipeline.quality.high-comp-threshold=2000000
 * salary-pipeline.quality.disclosure-threshold=100000
 * salary-pipeline.quality.headcount-drop-min=50
 * </pre>
 */
public class PipelineConfig {

    public static final String PREFIX = "salary-pipeline.";

    static final String DEFAULT_RAW_DIR = "raw";
    static final String DEFAULT_OUTPUT_DIR = "output";
    static final String DEFAULT_EMPLOYER_ALIASES = "dictionaries/employer_aliases.csv";
    static final String DEFAULT_JOB_ALIASES = "dictionaries/job_title_aliases.csv";
    static final int DEFAULT_TOP_EARNERS = 100;

    private final Path rawDir;
    private final Path outputDir;
    private final Path employerAliases;
    private final Path jobAliases;
    private final boolean skipValidation;
    private final int topEarnersLimit;
    private final CacheConfig cacheConfig;
    private final QualityThresholds qualityThresholds;

    private PipelineConfig(Builder builder) {
        this.rawDir = builder.rawDir;
        this.outputDir = builder.outputDir;
        this.employerAliases = builder.employerAliases;
        this.jobAliases = builder.jobAliases;
        this.skipValidation = builder.skipValidation;
        this.topEarnersLimit = builder.topEarnersLimit;
        this.cacheConfig = builder.cacheConfig;
        this.qualityThresholds = builder.qualityThresholds;
    }

    public Path getRawDir() {
        return rawDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getEmployerAliases() {
        return employerAliases;
    }

    public Path getJobAliases() {
        return jobAliases;
    }

    public boolean isSkipValidation() {
        return skipValidation;
    }

    public int getTopEarnersLimit() {
        return topEarnersLimit;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public QualityThresholds getQualityThresholds() {
        return qualityThresholds;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads every {@code salary-pipeline.*} key, falling back to the defaults for absent ones.
     */
    public static PipelineConfig fromConfig(Config config) {
        Objects.requireNonNull(config, "config is required");
        CacheConfig cacheDefaults = CacheConfig.defaults();
        return builder()
                .rawDir(Path.of(string(config, "raw-dir", DEFAULT_RAW_DIR)))
                .outputDir(Path.of(string(config, "output-dir", DEFAULT_OUTPUT_DIR)))
                .employerAliases(Path.of(string(config, "employer-aliases", DEFAULT_EMPLOYER_ALIASES)))
                .jobAliases(Path.of(string(config, "job-aliases", DEFAULT_JOB_ALIASES)))
                .skipValidation(config.getOptionalValue(PREFIX + "skip-validation", Boolean.class).orElse(false))
                .topEarnersLimit(config.getOptionalValue(PREFIX + "top-earners.limit", Integer.class)
                        .orElse(DEFAULT_TOP_EARNERS))
                .cacheConfig(new CacheConfig(
                        config.getOptionalValue(PREFIX + "cache.max-size", Integer.class)
                                .orElse(cacheDefaults.maxSize()),
                        config.getOptionalValue(PREFIX + "cache.enabled", Boolean.class)
                                .orElse(cacheDefaults.enabled())))
                .qualityThresholds(new QualityThresholds(
                        config.getOptionalValue(PREFIX + "quality.high-comp-threshold", Double.class)
                                .orElse(QualityThresholds.DEFAULT_HIGH_COMP),
                        config.getOptionalValue(PREFIX + "quality.disclosure-threshold", Double.class)
                                .orElse(QualityThresholds.DEFAULT_DISCLOSURE),
                        config.getOptionalValue(PREFIX + "quality.headcount-drop-min", Integer.class)
                                .orElse(QualityThresholds.DEFAULT_HEADCOUNT_DROP_MIN)))
                .build();
    }

    private static String string(Config config, String key, String defaultValue) {
        return config.getOptionalValue(PREFIX + key, String.class).orElse(defaultValue);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineConfig{rawDir=" + rawDir +
                ", outputDir=" + outputDir +
                ", employerAliases=" + employerAliases +
                ", jobAliases=" + jobAliases +
                ", skipValidation=" + skipValidation +
                ", topEarners=" + topEarnersLimit +
                ", cache=" + cacheConfig +
                ", quality=" + qualityThresholds + '}';
    }

    public static class Builder {
        private Path rawDir = Path.of(DEFAULT_RAW_DIR);
        private Path outputDir = Path.of(DEFAULT_OUTPUT_DIR);
        private Path employerAliases = Path.of(DEFAULT_EMPLOYER_ALIASES);
        private Path jobAliases = Path.of(DEFAULT_JOB_ALIASES);
        private boolean skipValidation = false;
        private int topEarnersLimit = DEFAULT_TOP_EARNERS;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private QualityThresholds qualityThresholds = QualityThresholds.defaults();

        public Builder rawDir(Path rawDir) {
            this.rawDir = Objects.requireNonNull(rawDir, "rawDir is required");
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = Objects.requireNonNull(outputDir, "outputDir is required");
            return this;
        }

        public Builder employerAliases(Path employerAliases) {
            this.employerAliases = Objects.requireNonNull(employerAliases, "employerAliases is required");
            return this;
        }

        public Builder jobAliases(Path jobAliases) {
            this.jobAliases = Objects.requireNonNull(jobAliases, "jobAliases is required");
            return this;
        }

        public Builder skipValidation(boolean skipValidation) {
            this.skipValidation = skipValidation;
            return this;
        }

        public Builder topEarnersLimit(int topEarnersLimit) {
            if (topEarnersLimit <= 0) {
                throw new IllegalArgumentException("topEarnersLimit must be positive");
            }
            this.topEarnersLimit = topEarnersLimit;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public Builder qualityThresholds(QualityThresholds qualityThresholds) {
            this.qualityThresholds = Objects.requireNonNull(qualityThresholds, "qualityThresholds is required");
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
