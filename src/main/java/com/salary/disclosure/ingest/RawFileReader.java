package com.salary.disclosure.ingest;

import com.salary.disclosure.bulk.CsvCodec;
import com.salary.disclosure.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads one yearly extract ({@code <year>.csv}) into raw records.
 *
 * <p>The year always comes from the file name; a year column in the file is ignored.
 * Files are decoded as UTF-8, falling back to ISO-8859-1 when the bytes are not valid UTF-8.
 * Text values are trimmed, short rows are padded with empty values and blank lines are skipped.</p>
 */
public class RawFileReader {
    private static final Logger log = LoggerFactory.getLogger(RawFileReader.class);

    private final CurrencyParser currencyParser;

    public RawFileReader(CurrencyParser currencyParser) {
        this.currencyParser = Objects.requireNonNull(currencyParser, "currencyParser is required");
    }

    public List<RawRecord> read(Path file) throws IOException, MissingFieldException {
        String name = file.getFileName().toString();
        int year = yearOf(name);
        return read(name, year, new StringReader(decode(Files.readAllBytes(file), name)));
    }

    public List<RawRecord> read(String inputName, int year, Reader reader) throws IOException, MissingFieldException {
        List<RawRecord> records = new ArrayList<>();
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            List<String> header = CsvCodec.readRecord(br);
            if (header == null) {
                throw new MissingFieldException(inputName, ColumnDictionary.REQUIRED);
            }
            if (!header.isEmpty() && header.get(0).startsWith("\uFEFF")) {
                header.set(0, header.get(0).substring(1));
            }
            Map<String, Integer> positions = ColumnDictionary.indexHeaders(header);
            List<String> missing = ColumnDictionary.missingRequired(positions);
            if (!missing.isEmpty()) {
                throw new MissingFieldException(inputName, missing);
            }

            List<String> row;
            while ((row = CsvCodec.readRecord(br)) != null) {
                if (row.size() == 1 && row.get(0).isBlank()) {
                    continue;
                }
                records.add(new RawRecord(
                        year,
                        text(row, positions, ColumnDictionary.SECTOR),
                        text(row, positions, ColumnDictionary.LAST_NAME),
                        text(row, positions, ColumnDictionary.FIRST_NAME),
                        text(row, positions, ColumnDictionary.EMPLOYER),
                        text(row, positions, ColumnDictionary.JOB_TITLE),
                        currencyParser.parse(text(row, positions, ColumnDictionary.SALARY)),
                        currencyParser.parse(text(row, positions, ColumnDictionary.BENEFITS))));
            }
        }
        log.debug("ingest.file input={} year={} rows={}", inputName, year, records.size());
        return records;
    }

    /**
     * Year encoded in a file name such as {@code 2019.csv}.
     *
     * @throws IllegalArgumentException when the name does not start with a year
     */
    public static int yearOf(String fileName) {
        String stem = fileName.split("\\.", 2)[0].trim();
        try {
            return Integer.parseInt(stem);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("File name does not encode a year: " + fileName, e);
        }
    }

    static String decode(byte[] bytes, String inputName) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.info("ingest.encodingFallback input={} charset=ISO-8859-1", inputName);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static String text(List<String> row, Map<String, Integer> positions, String column) {
        int index = positions.get(column);
        return index < row.size() ? row.get(index).trim() : "";
    }
}
