package com.connection.finder.metrics;

import com.connection.finder.source.ProviderOutcome;

import java.time.Duration;

/**
 * Records connection-finder metrics.
 * The default {@link NoOpMetricsService} does nothing, so the finder runs without a
 * metrics backend on the classpath.
 */
public interface MetricsService {

    void recordSearchDuration(Duration duration, boolean partial);

    void recordProviderCall(String sourceId, ProviderOutcome outcome, Duration duration);

    void incrementRecordsDropped(int count);

    void incrementIdentitiesMerged(int count);

    void recordResultCount(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
