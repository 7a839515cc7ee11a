package com.salary.disclosure.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A canonical employer or job.
 * The id depends on {@code canonicalName} alone; the family tag never feeds into it.
 *
 * @param kind          employer or job
 * @param id            unsigned 32-bit identifier held in a long
 * @param canonicalName normalized representative name, possibly empty
 * @param familyTag     derived attribute (job family), or null
 */
public record CanonicalEntity(EntityKind kind, long id, String canonicalName, String familyTag) {

    public CanonicalEntity {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        if (id < 0 || id > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("id must fit in 32 unsigned bits, got " + id);
        }
    }

    public static CanonicalEntity of(EntityKind kind, long id, String canonicalName) {
        return new CanonicalEntity(kind, id, canonicalName, null);
    }

    public Optional<String> family() {
        return Optional.ofNullable(familyTag);
    }
}
