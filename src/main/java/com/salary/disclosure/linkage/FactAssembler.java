package com.salary.disclosure.linkage;

import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.core.model.RawRecord;
import com.salary.disclosure.core.model.ResolvedRecord;
import com.salary.disclosure.registry.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw records into linked facts: employer resolution, job resolution, then
 * identity linkage. Each step is exposed separately so a caller can time and report
 * them as distinct stages. The employer and job dimensions accumulate in the
 * resolvers' registries.
 */
public class FactAssembler {
    private static final Logger log = LoggerFactory.getLogger(FactAssembler.class);

    private final IdentityLinker linker;

    public FactAssembler() {
        this(new IdentityLinker());
    }

    public FactAssembler(IdentityLinker linker) {
        this.linker = Objects.requireNonNull(linker, "linker is required");
    }

    /**
     * Canonical entity for each record, index-aligned with {@code records}. Employer
     * resolvers read the raw employer, job resolvers the raw job title.
     */
    public List<CanonicalEntity> resolve(EntityResolver resolver, List<RawRecord> records) {
        List<CanonicalEntity> resolved = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            String raw = resolver.getKind() == EntityKind.EMPLOYER ? record.employerRaw() : record.jobTitleRaw();
            resolved.add(resolver.resolve(raw));
        }
        log.info("entities.resolved kind={} records={} entities={}",
                resolver.getKind(), records.size(), resolver.getRegistry().size());
        return resolved;
    }

    public LinkageResult link(List<RawRecord> records, List<CanonicalEntity> employers,
                              List<CanonicalEntity> jobs) {
        if (records.size() != employers.size() || records.size() != jobs.size()) {
            throw new IllegalArgumentException("resolved entities must align with records: records="
                    + records.size() + " employers=" + employers.size() + " jobs=" + jobs.size());
        }
        List<ResolvedRecord> resolved = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            resolved.add(new ResolvedRecord(records.get(i), employers.get(i), jobs.get(i)));
        }
        return linker.link(resolved);
    }

    /**
     * All three steps in one call.
     */
    public LinkageResult assemble(EntityResolver employers, EntityResolver jobs, List<RawRecord> records) {
        if (employers.getKind() != EntityKind.EMPLOYER || jobs.getKind() != EntityKind.JOB) {
            throw new IllegalArgumentException("expected an employer and a job resolver, got "
                    + employers.getKind() + " and " + jobs.getKind());
        }
        return link(records, resolve(employers, records), resolve(jobs, records));
    }
}
