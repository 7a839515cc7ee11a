package com.salary.disclosure.alias;

import com.salary.disclosure.bulk.CsvCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads an alias table from CSV.
 *
 * <p>Expected format (further columns are ignored):</p>
 * <pre>
 * raw,canonical
 * "Toronto Police Service ",TORONTO POLICE SERVICE
 * Hydro One Inc.,HYDRO ONE NETWORKS
 * </pre>
 *
 * <p>Raw keys are taken verbatim, including surrounding whitespace. When a raw key
 * repeats, the last row wins. A row with a blank canonical cell carries no override
 * and is skipped.</p>
 */
public class AliasTableLoader {
    private static final Logger log = LoggerFactory.getLogger(AliasTableLoader.class);

    static final String RAW_COLUMN = "raw";
    static final String CANONICAL_COLUMN = "canonical";

    /**
     * Loads the table at {@code path}; a missing file yields an empty table.
     */
    public AliasTable load(Path path) throws IOException {
        Objects.requireNonNull(path, "path is required");
        if (!Files.exists(path)) {
            log.info("aliases.absent path={}", path);
            return AliasTable.empty();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            AliasTable table = load(reader);
            log.info("aliases.loaded path={} entries={}", path, table.size());
            return table;
        }
    }

    public AliasTable load(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        List<String> header = CsvCodec.readRecord(br);
        if (header == null) {
            return AliasTable.empty();
        }

        int rawIndex = indexOf(header, RAW_COLUMN);
        int canonicalIndex = indexOf(header, CANONICAL_COLUMN);
        if (rawIndex < 0 || canonicalIndex < 0) {
            throw new IOException("Alias table must have '" + RAW_COLUMN + "' and '"
                    + CANONICAL_COLUMN + "' columns, found " + header);
        }

        Map<String, String> overrides = new LinkedHashMap<>();
        List<String> row;
        long rowNumber = 1;
        while ((row = CsvCodec.readRecord(br)) != null) {
            rowNumber++;
            if (row.size() <= Math.max(rawIndex, canonicalIndex)) {
                log.debug("aliases.skipped row={} reason=short", rowNumber);
                continue;
            }
            String raw = row.get(rawIndex);
            String canonical = row.get(canonicalIndex);
            if (canonical.isBlank()) {
                log.warn("aliases.skipped row={} raw='{}' reason=blank_canonical", rowNumber, raw);
                continue;
            }
            String replaced = overrides.put(raw, canonical);
            if (replaced != null) {
                log.warn("aliases.duplicate row={} raw='{}' replaced='{}' kept='{}'", rowNumber, raw, replaced, canonical);
            }
        }
        return AliasTable.of(overrides);
    }

    private static int indexOf(List<String> header, String column) {
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).replace("\uFEFF", "").trim();
            if (name.equalsIgnoreCase(column)) {
                return i;
            }
        }
        return -1;
    }
}
