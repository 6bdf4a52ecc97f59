package com.field.audit.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDetection("node", "42", "7")) {
 *     log.info("field-audit.logged entries={}", entries.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one change-detection pass over a record revision.
     */
    public static LogContext forDetection(String entityKind, String entityId, String revisionId) {
        LogContext ctx = new LogContext();
        ctx.put("entityKind", entityKind);
        ctx.put("entityId", entityId);
        ctx.put("revisionId", revisionId);
        ctx.put("operation", "detect-changes");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
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
