package com.salary.disclosure.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Jaccard similarity (token overlap): |intersection| / |union| of the token sets.
 * The tokenizer is pluggable; by default strings are lower-cased and split on whitespace.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Function<String, Set<String>> tokenizer;

    public JaccardSimilarity() {
        this(JaccardSimilarity::whitespaceTokens);
    }

    public JaccardSimilarity(Function<String, Set<String>> tokenizer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer is required");
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return compute(tokenizer.apply(s1), tokenizer.apply(s2));
    }

    /**
     * Jaccard index of two token sets; two empty sets are identical.
     */
    public static double compute(Set<String> tokens1, Set<String> tokens2) {
        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return 1.0;
        }
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    static Set<String> whitespaceTokens(String s) {
        Set<String> tokens = new HashSet<>();
        for (String token : WHITESPACE.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
