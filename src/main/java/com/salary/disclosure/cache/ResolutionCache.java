package com.salary.disclosure.cache;

import com.salary.disclosure.core.model.EntityKind;

import java.util.Optional;

/**
 * Memoizes raw string to canonical string resolution, per entity kind.
 * A cache never changes results; it only saves repeated regex work on
 * raw strings that recur across thousands of rows.
 */
public interface ResolutionCache {

    /**
     * Gets a cached canonical value.
     *
     * @param kind the entity kind the raw value belongs to
     * @param raw  the raw, unnormalized input
     * @return the cached canonical value, or empty if not cached
     */
    Optional<String> get(EntityKind kind, String raw);

    /**
     * Caches a canonical value for a raw input.
     */
    void put(EntityKind kind, String raw, String canonical);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache described by the configuration.
     */
    static ResolutionCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResolutionCache(config) : new NoOpResolutionCache();
    }
}
