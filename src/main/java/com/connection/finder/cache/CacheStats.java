package com.connection.finder.cache;

/**
 * Cache counters.
 *
 * @param hitCount      number of cache hits
 * @param missCount     number of cache misses
 * @param evictionCount number of evictions
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
