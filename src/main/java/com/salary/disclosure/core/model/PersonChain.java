package com.salary.disclosure.core.model;

import java.util.List;

/**
 * Records believed to belong to one individual, in scan order (year, then total
 * compensation). A statistical approximation, not a verified identity.
 */
public record PersonChain(long personId, List<FactRecord> records) {

    public PersonChain {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("a chain holds at least one record");
        }
        records = List.copyOf(records);
    }

    public int firstYear() {
        return records.get(0).year();
    }

    public int lastYear() {
        return records.get(records.size() - 1).year();
    }

    public long employerId() {
        return records.get(0).employerId();
    }

    public int size() {
        return records.size();
    }
}
