package com.connection.finder.metrics;

import com.connection.finder.source.ProviderOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSearchDuration(Duration duration, boolean partial) {
    }

    @Override
    public void recordProviderCall(String sourceId, ProviderOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementRecordsDropped(int count) {
    }

    @Override
    public void incrementIdentitiesMerged(int count) {
    }

    @Override
    public void recordResultCount(int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
