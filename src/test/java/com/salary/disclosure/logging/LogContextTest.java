package com.salary.disclosure.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("forStage should set runId and stage in MDC")
    void forStageSetsMDC() {
        try (LogContext ctx = LogContext.forStage("run-1", "ingest")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("ingest", MDC.get("stage"));
        }
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("Nested contexts restore the enclosing values on close")
    void nestedContextsRestore() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext stage = LogContext.forStage("run-1", "ingest")) {
                try (LogContext input = LogContext.forInput("2019.csv")) {
                    assertEquals("2019.csv", MDC.get("inputFile"));
                    assertEquals("ingest", MDC.get("stage"));
                }
                assertNull(MDC.get("inputFile"));
            }
            assertEquals("run-1", MDC.get("runId"));
            assertNull(MDC.get("stage"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("An inner value overriding an outer one is undone on close")
    void overrideRestored() {
        try (LogContext outer = LogContext.forRun("run-1")) {
            try (LogContext inner = LogContext.forRun("run-2")) {
                assertEquals("run-2", MDC.get("runId"));
            }
            assertEquals("run-1", MDC.get("runId"));
        }
    }

    @Test
    @DisplayName("with() should add custom key-value pairs")
    void withAddsCustomKeys() {
        try (LogContext ctx = LogContext.forRun("run-1").with("command", "suggest-aliases")) {
            assertEquals("suggest-aliases", MDC.get("command"));
        }
        assertNull(MDC.get("command"));
    }

    @Test
    @DisplayName("generateRunId should produce unique IDs")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
