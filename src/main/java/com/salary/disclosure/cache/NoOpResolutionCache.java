package com.salary.disclosure.cache;

import com.salary.disclosure.core.model.EntityKind;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<String> get(EntityKind kind, String raw) {
        return Optional.empty();
    }

    @Override
    public void put(EntityKind kind, String raw, String canonical) {
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
