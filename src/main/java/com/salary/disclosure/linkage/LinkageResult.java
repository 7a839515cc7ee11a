package com.salary.disclosure.linkage;

import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.PersonChain;

import java.util.List;
import java.util.Optional;

/**
 * Output of identity linkage.
 *
 * @param facts         fact records in scan order (name key, year, total compensation)
 * @param chains        person chains ordered by person id; chain {@code i} has id {@code i + 1}
 * @param linksAccepted number of records joined to the preceding record's chain
 */
public record LinkageResult(List<FactRecord> facts, List<PersonChain> chains, long linksAccepted) {

    public LinkageResult {
        facts = facts != null ? List.copyOf(facts) : List.of();
        chains = chains != null ? List.copyOf(chains) : List.of();
    }

    public int chainCount() {
        return chains.size();
    }

    public Optional<PersonChain> chain(long personId) {
        if (personId < 1 || personId > chains.size()) {
            return Optional.empty();
        }
        return Optional.of(chains.get((int) (personId - 1)));
    }

    @Override
    public String toString() {
        return "LinkageResult{facts=" + facts.size() +
                ", chains=" + chains.size() +
                ", links=" + linksAccepted + '}';
    }
}
