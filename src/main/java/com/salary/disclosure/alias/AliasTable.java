package com.salary.disclosure.alias;

import java.util.Map;
import java.util.Optional;

/**
 * Operator-curated overrides from a raw, unnormalized string to a chosen canonical
 * string. Keys match the exact raw input. Immutable for the lifetime of a run.
 */
public final class AliasTable {

    private static final AliasTable EMPTY = new AliasTable(Map.of());

    private final Map<String, String> overrides;

    private AliasTable(Map<String, String> overrides) {
        this.overrides = overrides;
    }

    public static AliasTable of(Map<String, String> overrides) {
        return overrides == null || overrides.isEmpty() ? EMPTY : new AliasTable(Map.copyOf(overrides));
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    public Optional<String> lookup(String raw) {
        return raw == null ? Optional.empty() : Optional.ofNullable(overrides.get(raw));
    }

    public int size() {
        return overrides.size();
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }
}
