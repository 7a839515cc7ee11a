package com.salary.disclosure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.salary.disclosure.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed resolution cache, bounded by size. Thread-safe.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, String> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.info("CaffeineResolutionCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<String> get(EntityKind kind, String raw) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(kind, raw)));
    }

    @Override
    public void put(EntityKind kind, String raw, String canonical) {
        cache.put(new CacheKey(kind, raw), canonical);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    /**
     * Cache key combining entity kind and raw input.
     */
    record CacheKey(EntityKind kind, String raw) {}
}
