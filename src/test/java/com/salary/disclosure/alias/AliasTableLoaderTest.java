package com.salary.disclosure.alias;

import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.rules.CanonicalizationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AliasTableLoaderTest {

    private final AliasTableLoader loader = new AliasTableLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load raw to canonical pairs")
    void testLoad() throws IOException {
        String csv = """
                raw,canonical
                TTC,Toronto Transit Commission
                "Hydro One, Inc.",HYDRO ONE NETWORKS
                """;

        AliasTable table = loader.load(new StringReader(csv));

        assertEquals(2, table.size());
        assertEquals("Toronto Transit Commission", table.lookup("TTC").orElseThrow());
        assertEquals("HYDRO ONE NETWORKS", table.lookup("Hydro One, Inc.").orElseThrow());
        assertTrue(table.lookup("Unknown").isEmpty());
    }

    @Test
    @DisplayName("Extra columns and column order do not matter")
    void testExtraColumns() throws IOException {
        String csv = """
                note,canonical,raw
                merged 2019,CITY TORONTO,Toronto City
                """;

        AliasTable table = loader.load(new StringReader(csv));

        assertEquals("CITY TORONTO", table.lookup("Toronto City").orElseThrow());
    }

    @Test
    @DisplayName("The last row wins for a repeated raw key")
    void testDuplicateLastWins() throws IOException {
        String csv = """
                raw,canonical
                Acme,FIRST
                Acme,SECOND
                """;

        AliasTable table = loader.load(new StringReader(csv));

        assertEquals(1, table.size());
        assertEquals("SECOND", table.lookup("Acme").orElseThrow());
    }

    @Test
    @DisplayName("A row with a blank canonical cell is skipped")
    void testBlankCanonicalSkipped() throws IOException {
        String csv = """
                raw,canonical
                Hydro One Inc.,
                TTC,"  "
                Toronto City,CITY TORONTO
                """;

        AliasTable table = loader.load(new StringReader(csv));

        assertEquals(1, table.size());
        assertTrue(table.lookup("Hydro One Inc.").isEmpty());
        assertTrue(table.lookup("TTC").isEmpty());
    }

    @Test
    @DisplayName("A blank canonical cell leaves resolution to the canonicalizer")
    void testBlankCanonicalFallsBack() throws IOException {
        AliasTable table = loader.load(new StringReader("raw,canonical\nHydro One Inc.,\n"));
        AliasResolver resolver = new AliasResolver(EntityKind.EMPLOYER, CanonicalizationRules.employer(), table);

        assertEquals("HYDRO ONE", resolver.resolve("Hydro One Inc."));
        assertFalse(resolver.isAliased("Hydro One Inc."));
    }

    @Test
    @DisplayName("Missing file yields an empty table")
    void testMissingFile() throws IOException {
        AliasTable table = loader.load(tempDir.resolve("absent.csv"));
        assertTrue(table.isEmpty());
    }

    @Test
    @DisplayName("Should read a file with a byte order mark")
    void testFileWithBom() throws IOException {
        Path file = tempDir.resolve("employer_aliases.csv");
        Files.writeString(file, "\uFEFFraw,canonical\nTTC,Toronto Transit Commission\n", StandardCharsets.UTF_8);

        AliasTable table = loader.load(file);

        assertEquals(1, table.size());
    }

    @Test
    @DisplayName("Table without the required columns is an error")
    void testMissingColumns() {
        assertThrows(IOException.class, () -> loader.load(new StringReader("from,to\nA,B\n")));
    }

    @Test
    @DisplayName("Empty input yields an empty table")
    void testEmptyInput() throws IOException {
        assertTrue(loader.load(new StringReader("")).isEmpty());
    }
}
