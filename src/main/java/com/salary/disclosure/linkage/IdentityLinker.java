package com.salary.disclosure.linkage;

import com.salary.disclosure.core.model.FactRecord;
import com.salary.disclosure.core.model.PersonChain;
import com.salary.disclosure.core.model.ResolvedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Partitions per-year records into inferred "same individual" chains.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Records are scanned in (name key, year, total compensation) order; ties keep
 *       input order.</li>
 *   <li>A record joins the chain of the record just before it iff both share the name
 *       key, share the employer id, and are at most {@value #MAX_YEAR_GAP} years apart.
 *       Otherwise it starts a new chain.</li>
 *   <li>A record's person id is the number of chain starts at or before it in scan
 *       order, so ids are dense and start at 1.</li>
 * </ul>
 *
 * <p>Linking favours precision: a person who changes employer is split into several
 * chains rather than risk merging two different people who share a name. Job title is
 * deliberately not compared.</p>
 */
public class IdentityLinker {
    private static final Logger log = LoggerFactory.getLogger(IdentityLinker.class);

    public static final int MAX_YEAR_GAP = 2;

    private static final Comparator<Candidate> SCAN_ORDER = Comparator
            .comparing(Candidate::nameKey)
            .thenComparingInt(c -> c.record().raw().year())
            .thenComparingDouble(c -> c.record().raw().totalComp());

    public LinkageResult link(List<ResolvedRecord> records) {
        List<Candidate> ordered = new ArrayList<>(records.size());
        for (ResolvedRecord record : records) {
            ordered.add(new Candidate(record.nameKey(), record));
        }
        // List.sort is stable: duplicate rows keep their input order
        ordered.sort(SCAN_ORDER);

        List<FactRecord> facts = new ArrayList<>(ordered.size());
        List<PersonChain> chains = new ArrayList<>();
        List<FactRecord> currentChain = new ArrayList<>();
        long personId = 0;
        long links = 0;
        Candidate previous = null;

        for (Candidate current : ordered) {
            if (previous != null && shouldLink(previous.record(), current.record())) {
                links++;
            } else {
                if (!currentChain.isEmpty()) {
                    chains.add(new PersonChain(personId, currentChain));
                    currentChain = new ArrayList<>();
                }
                personId++;
            }
            FactRecord fact = FactRecord.of(current.record(), personId);
            facts.add(fact);
            currentChain.add(fact);
            previous = current;
        }
        if (!currentChain.isEmpty()) {
            chains.add(new PersonChain(personId, currentChain));
        }

        LinkageResult result = new LinkageResult(facts, chains, links);
        log.info("linkage.completed records={} chains={} links={}", facts.size(), chains.size(), links);
        return result;
    }

    /**
     * Whether {@code current} continues the chain of {@code previous}, the record just
     * before it in scan order.
     */
    public static boolean shouldLink(ResolvedRecord previous, ResolvedRecord current) {
        if (previous == null) {
            return false;
        }
        return previous.nameKey().equals(current.nameKey())
                && previous.employer().id() == current.employer().id()
                && current.raw().year() - previous.raw().year() <= MAX_YEAR_GAP;
    }

    private record Candidate(String nameKey, ResolvedRecord record) {}
}
