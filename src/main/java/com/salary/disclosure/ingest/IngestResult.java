package com.salary.disclosure.ingest;

import com.salary.disclosure.core.model.RawRecord;

import java.util.List;

/**
 * Result of reading the raw directory.
 *
 * @param records         rows from every accepted file, in file-name then row order
 * @param filesAccepted   number of files that contributed rows
 * @param rejected        files excluded from the run
 * @param malformedValues currency values that could not be parsed and were read as zero
 */
public record IngestResult(
        List<RawRecord> records,
        int filesAccepted,
        List<RejectedInput> rejected,
        long malformedValues
) {
    public IngestResult {
        records = records != null ? List.copyOf(records) : List.of();
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }

    /**
     * An input file excluded from the run.
     *
     * @param inputName file name
     * @param reason    why it was rejected
     */
    public record RejectedInput(String inputName, String reason) {}

    @Override
    public String toString() {
        return "IngestResult{records=" + records.size() +
                ", files=" + filesAccepted +
                ", rejected=" + rejected.size() +
                ", malformed=" + malformedValues + '}';
    }
}
