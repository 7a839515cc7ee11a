package com.salary.disclosure.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close. Contexts nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStage(runId, "link_persons")) {
 *     log.info("linkage.completed chains={}", chains);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        return ctx;
    }

    /**
     * Creates a log context for one stage of a run.
     */
    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for reading one input file.
     */
    public static LogContext forInput(String inputFile) {
        LogContext ctx = new LogContext();
        ctx.put("inputFile", inputFile);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            keys.add(key);
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Removes the keys this context added, restoring values set by an enclosing context.
     */
    @Override
    public void close() {
        for (String key : keys) {
            String outer = previous.get(key);
            if (outer != null) {
                MDC.put(key, outer);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}
