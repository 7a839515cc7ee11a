package com.salary.disclosure.linkage;

import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.MatchConfidence;
import com.salary.disclosure.core.model.RawRecord;
import com.salary.disclosure.core.model.ResolvedRecord;
import com.salary.disclosure.registry.EntityIds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityLinker Tests")
class IdentityLinkerTest {

    private final IdentityLinker linker = new IdentityLinker();

    private static ResolvedRecord record(int year, String first, String last, String employer, double salary) {
        RawRecord raw = new RawRecord(year, "Municipalities", last, first, employer, "Analyst", salary, 0.0);
        return new ResolvedRecord(raw,
                CanonicalEntity.of(EntityKind.EMPLOYER, EntityIds.idFor(employer), employer),
                new CanonicalEntity(EntityKind.JOB, EntityIds.idFor("ANALYST"), "ANALYST", "Other"));
    }

    private static List<Long> personIds(LinkageResult result) {
        return result.facts().stream().map(FactRecord::personId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Linking rule")
    class LinkingRule {

        @ParameterizedTest
        @DisplayName("Same name and employer link only within the year gap")
        @CsvSource({
                "2019,2020,true",
                "2018,2020,true",
                "2017,2020,false",
                "2020,2020,true"
        })
        void testYearGap(int firstYear, int secondYear, boolean linked) {
            LinkageResult result = linker.link(List.of(
                    record(firstYear, "John", "Smith", "ACME", 100_000),
                    record(secondYear, "John", "Smith", "ACME", 110_000)));

            assertEquals(linked ? 1 : 2, result.chainCount());
            assertEquals(linked ? 1 : 0, result.linksAccepted());
        }

        @Test
        @DisplayName("Different employers never share a person id")
        void testDifferentEmployers() {
            LinkageResult result = linker.link(List.of(
                    record(2019, "John", "Smith", "ACME", 100_000),
                    record(2020, "John", "Smith", "BETA", 110_000)));

            List<Long> ids = personIds(result);
            assertNotEquals(ids.get(0), ids.get(1));
        }

        @Test
        @DisplayName("Name key is case-insensitive and trimmed")
        void testNameKey() {
            LinkageResult result = linker.link(List.of(
                    record(2019, "john", "smith", "ACME", 100_000),
                    record(2020, "JOHN", "SMITH", "ACME", 110_000)));

            assertEquals(1, result.chainCount());
        }

        @Test
        @DisplayName("Only the immediately preceding record is compared")
        void testImmediatePredecessorOnly() {
            // Scan order is 2018 ACME, 2019 BETA, 2020 ACME: the BETA row breaks the ACME chain
            LinkageResult result = linker.link(List.of(
                    record(2018, "John", "Smith", "ACME", 100_000),
                    record(2019, "John", "Smith", "BETA", 100_000),
                    record(2020, "John", "Smith", "ACME", 100_000)));

            assertEquals(List.of(1L, 2L, 3L), personIds(result));
        }

        @Test
        @DisplayName("shouldLink is false without a predecessor")
        void testShouldLinkNull() {
            assertFalse(IdentityLinker.shouldLink(null, record(2020, "A", "B", "ACME", 1)));
        }
    }

    @Nested
    @DisplayName("Person ids")
    class PersonIds {

        @Test
        @DisplayName("Ids are dense from 1 in scan order")
        void testDenseIds() {
            LinkageResult result = linker.link(List.of(
                    record(2020, "Zoe", "Young", "ACME", 120_000),
                    record(2019, "Adam", "Baker", "ACME", 100_000),
                    record(2020, "Adam", "Baker", "ACME", 105_000)));

            assertEquals(List.of(1L, 1L, 2L), personIds(result));
            assertEquals("Adam", result.chain(1).orElseThrow().records().get(0).firstName());
            assertEquals(2019, result.chain(1).orElseThrow().firstYear());
            assertEquals(2020, result.chain(1).orElseThrow().lastYear());
            assertTrue(result.chain(3).isEmpty());
        }

        @Test
        @DisplayName("Within a year lower total compensation comes first")
        void testTotalCompOrder() {
            LinkageResult result = linker.link(List.of(
                    record(2020, "John", "Smith", "ACME", 150_000),
                    record(2020, "John", "Smith", "BETA", 100_000)));

            assertEquals(100_000, result.facts().get(0).totalComp());
            assertEquals("BETA", result.facts().get(0).employerCanonical());
        }

        @Test
        @DisplayName("Empty input yields no facts")
        void testEmpty() {
            LinkageResult result = linker.link(List.of());
            assertTrue(result.facts().isEmpty());
            assertEquals(0, result.chainCount());
        }

        @Test
        @DisplayName("Every fact carries High confidence")
        void testConfidence() {
            LinkageResult result = linker.link(List.of(record(2020, "A", "B", "ACME", 1)));
            assertEquals(MatchConfidence.HIGH, result.facts().get(0).matchConfidence());
        }
    }
}
