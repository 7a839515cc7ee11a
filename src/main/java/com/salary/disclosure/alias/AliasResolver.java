package com.salary.disclosure.alias;

import com.salary.disclosure.cache.NoOpResolutionCache;
import com.salary.disclosure.cache.ResolutionCache;
import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.metrics.NoOpPipelineMetrics;
import com.salary.disclosure.metrics.PipelineMetrics;
import com.salary.disclosure.rules.StringCanonicalizer;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a raw value to its canonical string: the operator override when the
 * exact raw value has one, otherwise the canonicalizer's output. Override values
 * are normalized too, so every canonical value shares one normal form.
 */
public class AliasResolver {

    private final EntityKind kind;
    private final StringCanonicalizer canonicalizer;
    private final AliasTable aliases;
    private final ResolutionCache cache;
    private final PipelineMetrics metrics;

    public AliasResolver(EntityKind kind, StringCanonicalizer canonicalizer, AliasTable aliases) {
        this(kind, canonicalizer, aliases, new NoOpResolutionCache(), new NoOpPipelineMetrics());
    }

    public AliasResolver(EntityKind kind, StringCanonicalizer canonicalizer, AliasTable aliases,
                         ResolutionCache cache, PipelineMetrics metrics) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer is required");
        this.aliases = aliases != null ? aliases : AliasTable.empty();
        this.cache = cache != null ? cache : new NoOpResolutionCache();
        this.metrics = metrics != null ? metrics : new NoOpPipelineMetrics();
    }

    public String resolve(String raw) {
        if (raw == null) {
            return canonicalizer.normalize(null);
        }

        Optional<String> cached = cache.get(kind, raw);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        String canonical = canonicalizer.normalize(aliases.lookup(raw).orElse(raw));
        cache.put(kind, raw, canonical);
        return canonical;
    }

    /**
     * Returns true when the raw value is covered by an operator override.
     */
    public boolean isAliased(String raw) {
        return aliases.lookup(raw).isPresent();
    }

    public EntityKind getKind() {
        return kind;
    }
}
