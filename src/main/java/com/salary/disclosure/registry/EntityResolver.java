package com.salary.disclosure.registry;

import com.salary.disclosure.alias.AliasResolver;
import com.salary.disclosure.alias.AliasTable;
import com.salary.disclosure.cache.ResolutionCache;
import com.salary.disclosure.core.model.CanonicalEntity;
import com.salary.disclosure.core.model.EntityKind;
import com.salary.disclosure.metrics.PipelineMetrics;
import com.salary.disclosure.rules.CanonicalizationRules;
import com.salary.disclosure.rules.JobFamilyClassifier;

import java.util.List;
import java.util.Objects;

/**
 * Resolves raw employer or job strings to registered canonical entities:
 * alias override or canonicalization first, then registration.
 *
 * <pre>
 * EntityResolver employers = EntityResolver.employers(aliases, cache, metrics);
 * CanonicalEntity acme = employers.resolve("Acme Inc.");   // "ACME"
 * </pre>
 */
public class EntityResolver {

    private final AliasResolver aliasResolver;
    private final EntityRegistry registry;

    public EntityResolver(AliasResolver aliasResolver, EntityRegistry registry) {
        this.aliasResolver = Objects.requireNonNull(aliasResolver, "aliasResolver is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        if (aliasResolver.getKind() != registry.getKind()) {
            throw new IllegalArgumentException("alias resolver kind " + aliasResolver.getKind()
                    + " does not match registry kind " + registry.getKind());
        }
    }

    /**
     * Employer resolution with the employer rule set and no family tag.
     */
    public static EntityResolver employers(AliasTable aliases, ResolutionCache cache, PipelineMetrics metrics) {
        return new EntityResolver(
                new AliasResolver(EntityKind.EMPLOYER, CanonicalizationRules.employer(), aliases, cache, metrics),
                new EntityRegistry(EntityKind.EMPLOYER, null, metrics));
    }

    /**
     * Job resolution with the job-title rule set, tagging each job with its family.
     */
    public static EntityResolver jobs(AliasTable aliases, ResolutionCache cache, PipelineMetrics metrics) {
        return new EntityResolver(
                new AliasResolver(EntityKind.JOB, CanonicalizationRules.jobTitle(), aliases, cache, metrics),
                new EntityRegistry(EntityKind.JOB, JobFamilyClassifier::familyLabel, metrics));
    }

    public CanonicalEntity resolve(String raw) {
        return registry.register(aliasResolver.resolve(raw));
    }

    public List<CanonicalEntity> entities() {
        return registry.entities();
    }

    public EntityRegistry getRegistry() {
        return registry;
    }

    public EntityKind getKind() {
        return registry.getKind();
    }
}
