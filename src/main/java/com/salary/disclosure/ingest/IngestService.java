package com.salary.disclosure.ingest;

import com.salary.disclosure.core.model.RawRecord;
import com.salary.disclosure.logging.LogContext;
import com.salary.disclosure.metrics.NoOpPipelineMetrics;
import com.salary.disclosure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reads every yearly extract in the raw directory, in file-name order.
 * Only {@code *.csv} files whose name starts with a digit are considered.
 * A file that cannot be used is rejected and the remaining files still load.
 */
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final Path rawDir;
    private final PipelineMetrics metrics;

    public IngestService(Path rawDir) {
        this(rawDir, new NoOpPipelineMetrics());
    }

    public IngestService(Path rawDir, PipelineMetrics metrics) {
        this.rawDir = Objects.requireNonNull(rawDir, "rawDir is required");
        this.metrics = metrics != null ? metrics : new NoOpPipelineMetrics();
    }

    /**
     * @throws IOException when the raw directory itself cannot be listed
     */
    public IngestResult ingest() throws IOException {
        CurrencyParser currencyParser = new CurrencyParser();
        RawFileReader reader = new RawFileReader(currencyParser);
        List<RawRecord> records = new ArrayList<>();
        List<IngestResult.RejectedInput> rejected = new ArrayList<>();
        int accepted = 0;

        for (Path file : listInputs()) {
            String name = file.getFileName().toString();
            try (LogContext ctx = LogContext.forInput(name)) {
                try {
                    List<RawRecord> rows = reader.read(file);
                    records.addAll(rows);
                    accepted++;
                    log.info("ingest.file input={} rows={}", name, rows.size());
                } catch (MissingFieldException e) {
                    reject(rejected, name, e.getMessage());
                } catch (IOException | RuntimeException e) {
                    reject(rejected, name, e.getClass().getSimpleName() + ": " + e.getMessage());
                }
            }
        }

        IngestResult result = new IngestResult(records, accepted, rejected, currencyParser.getMalformedCount());
        metrics.incrementRecordsIngested(records.size());
        metrics.incrementMalformedValues(result.malformedValues());
        if (result.malformedValues() > 0) {
            log.warn("ingest.malformedValues count={}", result.malformedValues());
        }
        log.info("ingest.completed result={}", result);
        return result;
    }

    List<Path> listInputs() throws IOException {
        List<Path> inputs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rawDir, "*.csv")) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                if (Files.isRegularFile(file) && !name.isEmpty() && Character.isDigit(name.charAt(0))) {
                    inputs.add(file);
                }
            }
        }
        inputs.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return inputs;
    }

    private void reject(List<IngestResult.RejectedInput> rejected, String name, String reason) {
        rejected.add(new IngestResult.RejectedInput(name, reason));
        metrics.incrementInputsRejected();
        log.warn("ingest.rejected input={} reason={}", name, reason);
    }
}
