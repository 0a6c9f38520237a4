package com.connection.finder.cache;

import com.connection.finder.api.SearchResult;

import java.util.Optional;

/**
 * Cache of complete search results.
 */
public interface SearchCache {

    /**
     * Gets a cached result.
     *
     * @param key the search key
     * @return the cached result, or empty if not cached or expired
     */
    Optional<SearchResult> get(SearchCacheKey key);

    /**
     * Caches a result. Implementations may refuse partial results.
     */
    void put(SearchCacheKey key, SearchResult result);

    /**
     * Invalidates every cached search for a normalized company.
     */
    void invalidateCompany(String normalizedCompany);

    void invalidateAll();

    CacheStats getStats();
}
