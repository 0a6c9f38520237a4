package com.connection.finder.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries added through this context are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSearch(correlationId, company)) {
 *     log.info("Searching {} sources", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSearch(String correlationId, String company) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("company", company);
        ctx.put("operation", "search");
        return ctx;
    }

    /**
     * Context for a single provider call. Runs on a pool thread, so the correlation id
     * is passed explicitly.
     */
    public static LogContext forProvider(String correlationId, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceId", sourceId);
        ctx.put("operation", "provider");
        return ctx;
    }

    public static String generateCorrelationId() {
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
