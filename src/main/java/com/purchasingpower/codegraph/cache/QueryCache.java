package com.purchasingpower.codegraph.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.purchasingpower.codegraph.configuration.CacheProperties;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-local cache for expensive read queries.
 *
 * <p>Entries are keyed by operation name plus a canonical JSON rendering of the
 * parameters (map keys sorted), so the same call with differently ordered
 * parameters hits the same entry. The cache is bounded three ways:
 * <ul>
 *   <li>entry count ({@code app.cache.max-entries})</li>
 *   <li>aggregate estimated size ({@code app.cache.max-size-mb}); a single entry larger
 *       than a quarter of it is never admitted</li>
 *   <li>time to live ({@code app.cache.ttl}), checked lazily on lookup and by a background
 *       sweep every {@code min(ttl / 4, max-sweep-interval)}</li>
 * </ul>
 *
 * <p>When an insert would cross the count or size bound, least-recently-accessed
 * entries are evicted until at most half the entry bound is in use and the new
 * entry fits.
 *
 * <p>All mutating operations synchronize on the instance; the sweep runs on its own
 * daemon thread and never blocks callers for longer than one pass over the entries.
 */
@Slf4j
public class QueryCache implements AutoCloseable {

    private final CacheProperties properties;
    private final ObjectWriter canonicalWriter;
    private final Clock clock;
    private final ScheduledExecutorService sweeper;

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long totalSize;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public QueryCache(CacheProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Clock.systemUTC(), true);
    }

    QueryCache(CacheProperties properties, ObjectMapper objectMapper, Clock clock, boolean startSweeper) {
        this.properties = properties;
        this.canonicalWriter = objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
        this.sweeper = startSweeper ? startSweeper() : null;
    }

    /**
     * Returns the cached value for the call, or empty when absent or expired.
     */
    @SuppressWarnings("unchecked")
    public synchronized <T> Optional<T> get(String method, Map<String, ?> params) {
        String key = buildKey(method, params);
        CacheEntry entry = entries.get(key);
        long now = clock.millis();

        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }
        if (isExpired(entry, now)) {
            removeEntry(key);
            recordMiss();
            return Optional.empty();
        }

        entry.lastAccessed = now;
        recordHit();
        return Optional.ofNullable((T) entry.value);
    }

    /**
     * Stores a value for the call unless it is too large to be admitted.
     *
     * @return true if the value is now cached
     */
    public synchronized boolean set(String method, Map<String, ?> params, Object value) {
        String key = buildKey(method, params);
        long size;
        try {
            size = estimateSize(value);
        } catch (JsonProcessingException e) {
            log.warn("Skipping cache entry {}: value is not serializable ({})", key, e.getOriginalMessage());
            return false;
        }

        long maxSize = properties.getMaxSizeBytes();
        if (size > maxSize / 4) {
            log.debug("Skipping cache entry {}: {} bytes exceeds admission limit {}", key, size, maxSize / 4);
            return false;
        }

        // Replacing a key must not count its old size twice
        if (entries.containsKey(key)) {
            removeEntry(key);
        }

        if (entries.size() >= properties.getMaxEntries() || totalSize + size > maxSize) {
            evict(size);
        }

        long now = clock.millis();
        entries.put(key, new CacheEntry(value, size, now));
        totalSize += size;
        return true;
    }

    /**
     * Returns the cached value or computes, caches and returns it.
     */
    public <T> T getOrCompute(String method, Map<String, ?> params, Supplier<T> loader) {
        Optional<T> cached = get(method, params);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            set(method, params, value);
        }
        return value;
    }

    public synchronized boolean invalidate(String method, Map<String, ?> params) {
        return removeEntry(buildKey(method, params));
    }

    /**
     * Removes every entry whose key contains the given substring.
     *
     * @return number of removed entries
     */
    public synchronized int invalidateByPattern(String pattern) {
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry> next = it.next();
            if (next.getKey().contains(pattern)) {
                totalSize -= next.getValue().size;
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Invalidated {} cache entries matching '{}'", removed, pattern);
        }
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
        totalSize = 0;
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }

    public synchronized CacheStats getStats() {
        long h = hits.get();
        long m = misses.get();
        double hitRate = (h + m) == 0 ? 0.0 : (double) h / (h + m);
        return new CacheStats(h, m, evictions.get(), entries.size(), totalSize, hitRate,
                properties.getMaxSizeBytes());
    }

    /**
     * Drops every expired entry.
     *
     * @return number of removed entries
     */
    public synchronized int removeExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry> next = it.next();
            if (isExpired(next.getValue(), now)) {
                totalSize -= next.getValue().size;
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    String buildKey(String method, Map<String, ?> params) {
        try {
            return method + ":" + canonicalWriter.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache parameters for " + method + " are not serializable", e);
        }
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private long estimateSize(Object value) throws JsonProcessingException {
        return canonicalWriter.writeValueAsString(value).getBytes(StandardCharsets.UTF_8).length;
    }

    private void evict(long neededSpace) {
        List<Map.Entry<String, CacheEntry>> byAccess = new ArrayList<>(entries.entrySet());
        byAccess.sort(Comparator.comparingLong(e -> e.getValue().lastAccessed));

        int halfEntries = properties.getMaxEntries() / 2;
        long maxSize = properties.getMaxSizeBytes();
        int evicted = 0;

        for (Map.Entry<String, CacheEntry> candidate : byAccess) {
            if (entries.size() <= halfEntries && totalSize + neededSpace <= maxSize) {
                break;
            }
            entries.remove(candidate.getKey());
            totalSize -= candidate.getValue().size;
            evicted++;
        }

        if (properties.isStatsEnabled()) {
            evictions.addAndGet(evicted);
        }
        log.debug("Evicted {} cache entries, {} remaining ({} bytes)", evicted, entries.size(), totalSize);
    }

    private boolean removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        totalSize -= removed.size;
        return true;
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return now - entry.createdAt > properties.getTtl().toMillis();
    }

    private void recordHit() {
        if (properties.isStatsEnabled()) {
            hits.incrementAndGet();
        }
    }

    private void recordMiss() {
        if (properties.isStatsEnabled()) {
            misses.incrementAndGet();
        }
    }

    private ScheduledExecutorService startSweeper() {
        long quarterTtl = Math.max(1, properties.getTtl().toMillis() / 4);
        long period = Math.min(quarterTtl, properties.getMaxSweepInterval().toMillis());

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("query-cache-sweeper-%d")
                        .setDaemon(true)
                        .build());
        executor.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
        log.debug("Cache expiry sweep scheduled every {}", Duration.ofMillis(period));
        return executor;
    }

    private void sweep() {
        try {
            int removed = removeExpired();
            if (removed > 0) {
                log.debug("Cache sweep removed {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            // A failed pass must not cancel the schedule
            log.warn("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    private static final class CacheEntry {
        private final Object value;
        private final long size;
        private final long createdAt;
        private long lastAccessed;

        private CacheEntry(Object value, long size, long createdAt) {
            this.value = value;
            this.size = size;
            this.createdAt = createdAt;
            this.lastAccessed = createdAt;
        }
    }
}
