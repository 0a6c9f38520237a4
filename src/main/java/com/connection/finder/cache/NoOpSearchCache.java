package com.connection.finder.cache;

import com.connection.finder.api.SearchResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpSearchCache implements SearchCache {

    @Override
    public Optional<SearchResult> get(SearchCacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(SearchCacheKey key, SearchResult result) {
        // no-op
    }

    @Override
    public void invalidateCompany(String normalizedCompany) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
