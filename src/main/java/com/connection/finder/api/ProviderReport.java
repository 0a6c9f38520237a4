package com.connection.finder.api;

import com.connection.finder.source.ProviderOutcome;

import java.time.Duration;
import java.util.Objects;

/**
 * What one provider contributed to a search.
 *
 * @param sourceId    provider identifier
 * @param outcome     how the call ended, or why it was not made
 * @param recordCount records returned by the provider
 * @param duration    time spent on the call, zero when not invoked
 * @param message     error or skip detail, may be null
 */
public record ProviderReport(String sourceId, ProviderOutcome outcome, int recordCount,
                             Duration duration, String message) {

    public ProviderReport {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(outcome, "outcome is required");
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static ProviderReport skipped(String sourceId, ProviderOutcome outcome, String message) {
        return new ProviderReport(sourceId, outcome, 0, Duration.ZERO, message);
    }
}
