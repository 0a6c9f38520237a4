package com.connection.finder.metrics;

import com.connection.finder.source.ProviderOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code finder.search.duration}: Timer (tag: partial)</li>
 *   <li>{@code finder.provider.call}: Timer (tags: source, outcome)</li>
 *   <li>{@code finder.records.dropped}: Counter</li>
 *   <li>{@code finder.identities.merged}: Counter</li>
 *   <li>{@code finder.search.results}: DistributionSummary</li>
 *   <li>{@code finder.cache.hit} and {@code finder.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter droppedCounter;
    private final Counter mergedCounter;
    private final DistributionSummary resultSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.droppedCounter = Counter.builder("finder.records.dropped")
                .description("Malformed person records dropped before aggregation")
                .register(registry);
        this.mergedCounter = Counter.builder("finder.identities.merged")
                .description("Records merged into an existing identity")
                .register(registry);
        this.resultSummary = DistributionSummary.builder("finder.search.results")
                .description("Number of people returned per search")
                .register(registry);
        this.cacheHitCounter = Counter.builder("finder.cache.hit")
                .description("Number of search cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("finder.cache.miss")
                .description("Number of search cache misses")
                .register(registry);
    }

    @Override
    public void recordSearchDuration(Duration duration, boolean partial) {
        String key = "search:" + partial;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("finder.search.duration")
                        .description("Duration of a complete search")
                        .tag("partial", String.valueOf(partial))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordProviderCall(String sourceId, ProviderOutcome outcome, Duration duration) {
        String key = "provider:" + sourceId + ":" + outcome.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("finder.provider.call")
                        .description("Duration of individual provider calls")
                        .tag("source", sourceId)
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecordsDropped(int count) {
        if (count > 0) {
            droppedCounter.increment(count);
        }
    }

    @Override
    public void incrementIdentitiesMerged(int count) {
        if (count > 0) {
            mergedCounter.increment(count);
        }
    }

    @Override
    public void recordResultCount(int count) {
        resultSummary.record(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
