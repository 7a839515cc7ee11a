package com.salary.disclosure.registry;

import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.metrics.NoOpPipelineMetrics;
import com.salary.disclosure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assigns and caches one {@link CanonicalEntity} per distinct canonical name for a
 * single pipeline run. Writes are once per key: the first registration of a name
 * wins and later ones return the same instance. Thread-safe.
 *
 * <p>The registry's output artifact is the deduplicated entity table,
 * see {@link #entities()}.</p>
 */
public class EntityRegistry {
    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    private final EntityKind kind;
    private final Function<String, String> familyFunction;
    private final PipelineMetrics metrics;
    private final ConcurrentMap<String, CanonicalEntity> entities = new ConcurrentHashMap<>();

    public EntityRegistry(EntityKind kind) {
        this(kind, null, new NoOpPipelineMetrics());
    }

    /**
     * @param kind           the kind of entity registered here
     * @param familyFunction derives the family tag from the canonical name, or null for none
     * @param metrics        metrics sink
     */
    public EntityRegistry(EntityKind kind, Function<String, String> familyFunction, PipelineMetrics metrics) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.familyFunction = familyFunction;
        this.metrics = metrics != null ? metrics : new NoOpPipelineMetrics();
    }

    /**
     * Returns the identifier of a canonical name, registering it if new.
     */
    public long idFor(String canonicalName) {
        return register(canonicalName).id();
    }

    /**
     * Returns the entity for a canonical name, registering it if new.
     */
    public CanonicalEntity register(String canonicalName) {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        CanonicalEntity existing = entities.get(canonicalName);
        if (existing != null) {
            return existing;
        }
        return entities.computeIfAbsent(canonicalName, this::create);
    }

    /**
     * The deduplicated entity table, ordered by canonical name.
     */
    public List<CanonicalEntity> entities() {
        return entities.values().stream()
                .sorted(Comparator.comparing(CanonicalEntity::canonicalName))
                .collect(Collectors.toList());
    }

    public int size() {
        return entities.size();
    }

    public EntityKind getKind() {
        return kind;
    }

    private CanonicalEntity create(String canonicalName) {
        String family = familyFunction != null ? familyFunction.apply(canonicalName) : null;
        CanonicalEntity entity = new CanonicalEntity(kind, EntityIds.idFor(canonicalName), canonicalName, family);
        metrics.incrementEntityRegistered(kind);
        log.trace("registry.added kind={} id={} name='{}'", kind, entity.id(), canonicalName);
        return entity;
    }
}
