package com.registry.reconciliation.logging;

import org.slf4j.MDC;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBuild(buildId, asOf)) {
 *     log.info("snapshot.built records={}", size);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a snapshot build.
     */
    public static LogContext forBuild(String buildId, LocalDate asOf) {
        LogContext ctx = new LogContext();
        ctx.put("buildId", buildId);
        ctx.put("asOf", String.valueOf(asOf));
        ctx.put("operation", "build");
        return ctx;
    }

    /**
     * Creates a log context for comparing two snapshots.
     */
    public static LogContext forDiff(LocalDate baselineDate, LocalDate currentDate) {
        LogContext ctx = new LogContext();
        ctx.put("baselineDate", String.valueOf(baselineDate));
        ctx.put("currentDate", String.valueOf(currentDate));
        ctx.put("operation", "diff");
        return ctx;
    }

    public static String generateBuildId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
