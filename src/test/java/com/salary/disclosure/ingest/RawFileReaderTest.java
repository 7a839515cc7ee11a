package com.salary.disclosure.ingest;

import com.salary.disclosure.core.model.RawRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RawFileReader Tests")
class RawFileReaderTest {

    private static final String HEADER =
            "Sector,Last Name,First Name,Salary Paid,Taxable Benefits,Employer,Job Title,Calendar Year\n";

    private CurrencyParser currencyParser;
    private RawFileReader reader;

    @BeforeEach
    void setUp() {
        currencyParser = new CurrencyParser();
        reader = new RawFileReader(currencyParser);
    }

    @Nested
    @DisplayName("Row parsing")
    class RowParsing {

        @Test
        @DisplayName("Rows are trimmed and amounts parsed")
        void testRows() throws Exception {
            String csv = HEADER
                    + "Universities, Smith ,John,\"$120,000.50\",$1000,Acme Inc.,Professor,1999\n"
                    + "\n"
                    + "Colleges,Doe,Jane,-,,\"Beta, Corp\",\"Director, \"\"Ops\"\"\",1999\n";

            List<RawRecord> records = reader.read("2020.csv", 2020, new StringReader(csv));

            assertEquals(2, records.size());
            RawRecord first = records.get(0);
            assertEquals(2020, first.year());
            assertEquals("Smith", first.lastName());
            assertEquals(120_000.50, first.salary(), 1e-9);
            assertEquals(1000.0, first.benefits(), 1e-9);
            assertEquals(121_000.50, first.totalComp(), 1e-9);

            RawRecord second = records.get(1);
            assertEquals("Beta, Corp", second.employerRaw());
            assertEquals("Director, \"Ops\"", second.jobTitleRaw());
            assertEquals(0.0, second.totalComp());
            assertEquals(0, currencyParser.getMalformedCount());
        }

        @Test
        @DisplayName("Short rows are padded with empty values")
        void testShortRow() throws Exception {
            List<RawRecord> records = reader.read("2020.csv", 2020,
                    new StringReader(HEADER + "Colleges,Doe,Jane,100\n"));

            assertEquals(1, records.size());
            assertEquals("", records.get(0).employerRaw());
            assertEquals("", records.get(0).jobTitleRaw());
        }

        @Test
        @DisplayName("A byte order mark does not hide the first header")
        void testByteOrderMark() throws Exception {
            List<RawRecord> records = reader.read("2020.csv", 2020,
                    new StringReader("\uFEFF" + HEADER + "Colleges,Doe,Jane,100,0,Beta,Clerk,2020\n"));
            assertEquals("Colleges", records.get(0).sector());
        }

        @Test
        @DisplayName("Unparseable amounts read as zero and are counted")
        void testMalformedAmount() throws Exception {
            List<RawRecord> records = reader.read("2020.csv", 2020,
                    new StringReader(HEADER + "Colleges,Doe,Jane,unknown,0,Beta,Clerk,2020\n"));
            assertEquals(0.0, records.get(0).salary());
            assertEquals(1, currencyParser.getMalformedCount());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Missing required columns are named")
        void testMissingColumns() {
            MissingFieldException e = assertThrows(MissingFieldException.class, () ->
                    reader.read("2020.csv", 2020, new StringReader("Sector,Last Name,First Name,Employer\n")));

            assertEquals("2020.csv", e.getInputName());
            assertEquals(List.of("salary", "benefits", "job_title"), e.getMissingColumns());
            assertTrue(e.getMessage().contains("2020.csv"));
        }

        @Test
        @DisplayName("An empty input has no header")
        void testEmptyInput() {
            assertThrows(MissingFieldException.class, () ->
                    reader.read("2020.csv", 2020, new StringReader("")));
        }
    }

    @Nested
    @DisplayName("Files")
    class FileInputs {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("The file name decides the year")
        void testYearFromFileName() throws Exception {
            Path file = tempDir.resolve("2018.csv");
            Files.writeString(file, HEADER + "Colleges,Doe,Jane,100,0,Beta,Clerk,2020\n");

            assertEquals(2018, reader.read(file).get(0).year());
        }

        @Test
        @DisplayName("Invalid UTF-8 falls back to ISO-8859-1")
        void testEncodingFallback() throws Exception {
            Path file = tempDir.resolve("2019.csv");
            Files.write(file, (HEADER + "Colleges,Lefèvre,José,100,0,Beta,Clerk,2019\n")
                    .getBytes(StandardCharsets.ISO_8859_1));

            RawRecord record = reader.read(file).get(0);
            assertEquals("Lefèvre", record.lastName());
            assertEquals("José", record.firstName());
        }

        @Test
        @DisplayName("UTF-8 input is decoded as UTF-8")
        void testUtf8() throws Exception {
            Path file = tempDir.resolve("2019.csv");
            Files.write(file, (HEADER + "Colleges,Lefèvre,José,100,0,Beta,Clerk,2019\n")
                    .getBytes(StandardCharsets.UTF_8));

            assertEquals("Lefèvre", reader.read(file).get(0).lastName());
        }
    }

    @Test
    @DisplayName("Year parsing from file names")
    void testYearOf() {
        assertEquals(2019, RawFileReader.yearOf("2019.csv"));
        assertEquals(2019, RawFileReader.yearOf("2019.backup.csv"));
        assertThrows(IllegalArgumentException.class, () -> RawFileReader.yearOf("2019a.csv"));
    }
}
