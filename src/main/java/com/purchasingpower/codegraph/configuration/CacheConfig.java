package com.purchasingpower.codegraph.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.cache.QueryCache;
import com.purchasingpower.codegraph.cache.QueryCacheAdapter;
import com.purchasingpower.codegraph.cache.TraversalKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Query cache wiring. Traversal results are cached through {@code @Cacheable},
 * backed by the process-local {@link QueryCache}.
 */
@Slf4j
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String TRAVERSAL_CACHE = "traverse";
    public static final String TRAVERSAL_KEY_GENERATOR = "traversalKeyGenerator";

    @Bean(destroyMethod = "close")
    public QueryCache queryCache(AppProperties appProperties, ObjectMapper objectMapper) {
        CacheProperties props = appProperties.getCache();
        log.info("✅ Query cache configured: maxEntries={}, ttl={}, maxSize={}MB, stats={}",
                props.getMaxEntries(), props.getTtl(), props.getMaxSizeMb(), props.isStatsEnabled());
        return new QueryCache(props, objectMapper);
    }

    @Bean
    public CacheManager cacheManager(QueryCache queryCache) {
        SimpleCacheManager cacheManager = new SimpleCacheManager();
        cacheManager.setCaches(List.of(new QueryCacheAdapter(TRAVERSAL_CACHE, queryCache)));
        return cacheManager;
    }

    @Bean(name = TRAVERSAL_KEY_GENERATOR)
    public KeyGenerator traversalKeyGenerator(AppProperties appProperties) {
        return new TraversalKeyGenerator(appProperties.getTraversal());
    }
}
