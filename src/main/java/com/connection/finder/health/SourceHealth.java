package com.connection.finder.health;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a provider's health.
 *
 * @param sourceId            provider identifier
 * @param status              current status
 * @param consecutiveFailures failures since the last success
 * @param lastSuccessAt       time of the last success, or null
 * @param lastFailureAt       time of the last failure, or null
 * @param totalSuccesses      successes since the tracker was created or reset
 * @param totalFailures       failures since the tracker was created or reset
 * @param lastLatency         duration of the last recorded call, or null
 */
public record SourceHealth(
        String sourceId,
        SourceStatus status,
        int consecutiveFailures,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        long totalSuccesses,
        long totalFailures,
        Duration lastLatency
) {
    public SourceHealth {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(status, "status is required");
    }

    /**
     * Health of a provider that has never been invoked.
     */
    public static SourceHealth initial(String sourceId) {
        return new SourceHealth(sourceId, SourceStatus.HEALTHY, 0, null, null, 0, 0, null);
    }

    public boolean isDisabled() {
        return status == SourceStatus.DISABLED;
    }
}
