package com.salary.disclosure.cli;

import com.salary.disclosure.alias.AliasSuggestion;
import com.salary.disclosure.bulk.PipelineOutputWriter;
import com.salary.disclosure.config.PipelineConfig;
import com.salary.disclosure.metrics.MicrometerPipelineMetrics;
import com.salary.disclosure.pipeline.PipelineException;
import com.salary.disclosure.pipeline.PipelineResult;
import com.salary.disclosure.pipeline.SalaryPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar salary-disclosure-pipeline.jar [run|suggest-aliases] [--key=value ...]
 * </pre>
 *
 * <p>Keys are the {@code salary-pipeline.*} configuration keys, with or without the prefix,
 * e.g. {@code --raw-dir=data/raw --skip-validation=true}. Command-line values override
 * system properties, environment variables and {@code META-INF/microprofile-config.properties}.</p>
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String RUN = "run";
    static final String SUGGEST_ALIASES = "suggest-aliases";
    static final int COMMAND_LINE_ORDINAL = 500;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    /**
     * Runs a command and returns the process exit code.
     */
    static int run(String[] args, PrintStream out) {
        String command = RUN;
        Map<String, String> overrides = new HashMap<>();
        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                printUsage(out);
                return 0;
            }
            if (arg.startsWith("--")) {
                int eq = arg.indexOf('=');
                if (eq < 0) {
                    out.println("Expected --key=value, got " + arg);
                    printUsage(out);
                    return 1;
                }
                overrides.put(configKey(arg.substring(2, eq)), arg.substring(eq + 1));
            } else {
                command = arg;
            }
        }

        PipelineConfig config;
        try {
            config = PipelineConfig.fromConfig(buildConfig(overrides));
        } catch (IllegalArgumentException e) {
            out.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        try {
            switch (command) {
                case RUN:
                    return runPipeline(config, out);
                case SUGGEST_ALIASES:
                    return suggestAliases(config, out);
                default:
                    out.println("Unknown command: " + command);
                    printUsage(out);
                    return 1;
            }
        } catch (PipelineException e) {
            log.error("pipeline.failed stage={} error={}", e.getStage().getId(), e.getMessage());
            out.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("output.failed error={}", e.getMessage(), e);
            out.println("Failed to write output: " + e.getMessage());
            return 1;
        }
    }

    private static int runPipeline(PipelineConfig config, PrintStream out) throws IOException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SalaryPipeline pipeline = new SalaryPipeline(config, new MicrometerPipelineMetrics(registry), Clock.systemUTC());
        PipelineResult result = pipeline.run();
        new PipelineOutputWriter().write(result, config.getOutputDir());

        out.printf("Records: %d, persons: %d, employers: %d, jobs: %d%n",
                result.facts().size(), result.linkage().chainCount(),
                result.employers().size(), result.jobs().size());
        result.quality().ifPresent(report -> out.println("Data quality issues: " + report.issueCounts()));
        if (result.ingest().hasRejections()) {
            out.println("Rejected inputs: " + result.ingest().rejected().size());
        }
        out.println("Output written to " + config.getOutputDir().toAbsolutePath());
        return 0;
    }

    private static int suggestAliases(PipelineConfig config, PrintStream out) throws IOException {
        List<AliasSuggestion> suggestions = new SalaryPipeline(config).suggestAliases();
        Path file = config.getOutputDir().resolve(PipelineOutputWriter.SUGGESTIONS_FILE);
        new PipelineOutputWriter().writeAliasSuggestions(suggestions, file);
        out.println("Suggestions: " + suggestions.size() + ", written to " + file.toAbsolutePath());
        out.println("Review them before adding any to the employer alias table.");
        return 0;
    }

    static Config buildConfig(Map<String, String> overrides) {
        return new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "command-line", COMMAND_LINE_ORDINAL))
                .build();
    }

    static String configKey(String name) {
        return name.startsWith(PipelineConfig.PREFIX) ? name : PipelineConfig.PREFIX + name;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: salary-disclosure-pipeline [run|suggest-aliases] [--key=value ...]");
        out.println("  --raw-dir=DIR             yearly extracts (<year>.csv)");
        out.println("  --output-dir=DIR          curated and analytics output");
        out.println("  --employer-aliases=FILE   raw,canonical employer overrides");
        out.println("  --job-aliases=FILE        raw,canonical job-title overrides");
        out.println("  --skip-validation=true    skip the data quality stage");
        out.println("  --top-earners.limit=N     top earners per year");
    }
}
