package com.connection.finder.cache;

import com.connection.finder.api.SearchResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Caffeine-backed search cache with a company index for targeted invalidation.
 * Partial results are never stored; returned results are copies.
 */
public class CaffeineSearchCache implements SearchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSearchCache.class);

    private final Cache<SearchCacheKey, SearchResult> cache;
    // normalized company -> keys cached for it
    private final ConcurrentMap<String, Set<SearchCacheKey>> companyIndex = new ConcurrentHashMap<>();

    public CaffeineSearchCache(CacheConfig config) {
        this(config, ForkJoinPool.commonPool());
    }

    CaffeineSearchCache(CacheConfig config, Executor executor) {
        this.cache = Caffeine.newBuilder()
                .executor(executor)
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((SearchCacheKey key, SearchResult value, RemovalCause cause) -> {
                    if (key != null && cause != RemovalCause.REPLACED) {
                        removeFromIndex(key);
                    }
                })
                .build();
        log.info("CaffeineSearchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<SearchResult> get(SearchCacheKey key) {
        SearchResult result = cache.getIfPresent(key);
        return Optional.ofNullable(result).map(SearchResult::copy);
    }

    @Override
    public void put(SearchCacheKey key, SearchResult result) {
        if (result.isPartial()) {
            log.debug("Not caching partial result for {}", key);
            return;
        }
        companyIndex.compute(key.normalizedCompany(), (company, keys) -> {
            Set<SearchCacheKey> updated = keys != null ? keys : ConcurrentHashMap.newKeySet();
            updated.add(key);
            return updated;
        });
        cache.put(key, result.copy());
    }

    @Override
    public void invalidateCompany(String normalizedCompany) {
        Set<SearchCacheKey> keys = companyIndex.remove(normalizedCompany);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("Invalidated {} cached searches for company '{}'", keys.size(), normalizedCompany);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        companyIndex.clear();
        log.debug("Invalidated all cached searches");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize());
    }

    int indexedCompanyCount() {
        return companyIndex.size();
    }

    void cleanUp() {
        cache.cleanUp();
    }

    // Empty sets are dropped so the index only holds companies with live entries
    private void removeFromIndex(SearchCacheKey key) {
        companyIndex.computeIfPresent(key.normalizedCompany(), (company, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }
}
