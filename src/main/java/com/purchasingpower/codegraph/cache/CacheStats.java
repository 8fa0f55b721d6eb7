package com.purchasingpower.codegraph.cache;

/**
 * Point-in-time statistics of a {@link QueryCache}.
 *
 * @param hits         lookups answered from the cache
 * @param misses       lookups that found nothing or an expired entry
 * @param evictions    entries removed to make room for new ones
 * @param totalEntries entries currently held
 * @param totalSize    aggregate estimated size of held entries, in bytes
 * @param hitRate      hits / (hits + misses), 0 when nothing was looked up
 * @param maxSize      configured aggregate size bound, in bytes
 */
public record CacheStats(
        long hits,
        long misses,
        long evictions,
        int totalEntries,
        long totalSize,
        double hitRate,
        long maxSize
) {
}
