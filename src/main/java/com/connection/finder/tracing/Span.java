package com.connection.finder.tracing;

/**
 * A traced unit of work: one search or one provider call. Closing the span ends it.
 *
 * <pre>
 * try (Span span = tracing.startSpan("finder.search")) {
 *     span.setAttribute("budget", 10L);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Marks a point in time within the span, e.g. a budget or deadline cut-off.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
