package com.purchasingpower.codegraph.cache;

import org.springframework.cache.support.AbstractValueAdaptingCache;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Exposes one named region of a {@link QueryCache} through Spring's cache abstraction.
 *
 * <p>The region name becomes the query cache operation, and the generated key must be
 * a parameter map so that it is rendered canonically. Other keys are wrapped under
 * {@code "key"}. Null values are never stored.
 */
public class QueryCacheAdapter extends AbstractValueAdaptingCache {

    private final String name;
    private final QueryCache queryCache;

    public QueryCacheAdapter(String name, QueryCache queryCache) {
        super(false);
        this.name = name;
        this.queryCache = queryCache;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public QueryCache getNativeCache() {
        return queryCache;
    }

    @Override
    protected Object lookup(Object key) {
        return queryCache.get(name, paramsOf(key)).orElse(null);
    }

    @Override
    public <T> T get(Object key, Callable<T> valueLoader) {
        return queryCache.getOrCompute(name, paramsOf(key), () -> {
            try {
                return valueLoader.call();
            } catch (Exception e) {
                throw new ValueRetrievalException(key, valueLoader, e);
            }
        });
    }

    @Override
    public void put(Object key, Object value) {
        if (value != null) {
            queryCache.set(name, paramsOf(key), value);
        }
    }

    @Override
    public void evict(Object key) {
        queryCache.invalidate(name, paramsOf(key));
    }

    @Override
    public boolean evictIfPresent(Object key) {
        return queryCache.invalidate(name, paramsOf(key));
    }

    @Override
    public void clear() {
        queryCache.invalidateByPattern(name + ":");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> paramsOf(Object key) {
        if (key instanceof Map) {
            return (Map<String, ?>) key;
        }
        return Map.of("key", key);
    }
}
