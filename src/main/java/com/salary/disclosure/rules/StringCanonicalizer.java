package com.salary.disclosure.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Applies an ordered rule set to raw text and produces its canonical form.
 *
 * <p>Every configuration shares the same routine: upper-case, apply the rules in
 * priority order, collapse whitespace runs to one space, trim. The result is total
 * (non-text input yields the empty string) and the shipped rule sets keep it
 * idempotent.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class StringCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(StringCanonicalizer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String name;
    private final List<NormalizationRule> rules;

    public StringCanonicalizer(String name, List<NormalizationRule> rules) {
        this.name = name;
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public String getName() {
        return name;
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Returns a copy of this canonicalizer with one more rule.
     */
    public StringCanonicalizer withRule(NormalizationRule rule) {
        List<NormalizationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new StringCanonicalizer(name, extended);
    }

    /**
     * Normalizes any value; anything other than a string normalizes to "".
     */
    public String normalize(Object raw) {
        if (!(raw instanceof String text) || text.isBlank()) {
            return "";
        }

        String result = text.toUpperCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Checks if two values share a canonical form.
     */
    public boolean areEquivalent(Object first, Object second) {
        return normalize(first).equals(normalize(second));
    }

    @Override
    public String toString() {
        return "StringCanonicalizer{name='" + name + "', rules=" + rules.size() + '}';
    }
}
