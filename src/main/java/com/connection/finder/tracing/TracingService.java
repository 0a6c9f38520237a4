package com.connection.finder.tracing;

import java.util.Map;

/**
 * Starts spans around searches and provider calls.
 * {@link NoOpTracingService} is the default when no tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
