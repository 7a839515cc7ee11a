package com.salary.disclosure.alias;

import com.salary.disclosure.rules.CanonicalizationRules;
import com.salary.disclosure.rules.StringCanonicalizer;
import com.salary.disclosure.similarity.JaccardSimilarity;
import com.salary.disclosure.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Proposes employer aliases from the raw employer strings of a run.
 *
 * <p>Two passes:</p>
 * <ol>
 *   <li>Raw strings with the same comparison form are grouped; the longest variant becomes
 *       the canonical for the others ({@code exact_normalized_match}).</li>
 *   <li>Raw strings longer than {@value #MIN_KEYWORD_LENGTH} characters with at least two key
 *       words are compared pairwise; pairs whose key-word Jaccard similarity reaches the
 *       threshold map the shorter string to the longer ({@code keyword_similarity_0.xx}).</li>
 * </ol>
 * <p>Suggestions are deduplicated on (raw, canonical) and sorted by canonical.
 * Nothing is applied automatically.</p>
 */
public class AliasSuggestionGenerator {
    private static final Logger log = LoggerFactory.getLogger(AliasSuggestionGenerator.class);

    public static final double DEFAULT_MIN_SIMILARITY = 0.7;
    static final int MIN_KEYWORD_LENGTH = 10;
    static final int MIN_KEY_WORDS = 2;

    static final String EXACT_REASON = "exact_normalized_match";
    static final String KEYWORD_REASON_PREFIX = "keyword_similarity_";

    private final StringCanonicalizer comparison;
    private final SimilarityAlgorithm similarity;
    private final double minSimilarity;

    public AliasSuggestionGenerator() {
        this(DEFAULT_MIN_SIMILARITY);
    }

    public AliasSuggestionGenerator(double minSimilarity) {
        if (minSimilarity <= 0.0 || minSimilarity > 1.0) {
            throw new IllegalArgumentException("minSimilarity must be in (0, 1], got " + minSimilarity);
        }
        this.comparison = CanonicalizationRules.comparison();
        this.similarity = new JaccardSimilarity(this::keyWords);
        this.minSimilarity = minSimilarity;
    }

    /**
     * @param rawEmployers raw employer strings; duplicates and blanks are ignored
     */
    public List<AliasSuggestion> suggest(List<String> rawEmployers) {
        List<String> employers = new ArrayList<>(new LinkedHashSet<>(rawEmployers));
        employers.removeIf(employer -> employer == null || employer.isEmpty());

        List<AliasSuggestion> all = new ArrayList<>();
        List<AliasSuggestion> exact = exactMatches(employers);
        List<AliasSuggestion> keyword = keywordMatches(employers);
        all.addAll(exact);
        all.addAll(keyword);

        Set<List<String>> seen = new HashSet<>();
        List<AliasSuggestion> unique = new ArrayList<>();
        for (AliasSuggestion suggestion : all) {
            if (seen.add(List.of(suggestion.raw(), suggestion.canonical()))) {
                unique.add(suggestion);
            }
        }
        unique.sort(Comparator.comparing(AliasSuggestion::canonical));

        log.info("aliases.suggested employers={} exact={} keyword={} total={}",
                employers.size(), exact.size(), keyword.size(), unique.size());
        return unique;
    }

    List<AliasSuggestion> exactMatches(List<String> employers) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String employer : employers) {
            String key = comparison.normalize(employer);
            if (!key.isEmpty()) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(employer);
            }
        }

        List<AliasSuggestion> suggestions = new ArrayList<>();
        for (List<String> variations : groups.values()) {
            if (variations.size() < 2) {
                continue;
            }
            String canonical = variations.get(0);
            for (String variation : variations) {
                if (variation.length() > canonical.length()) {
                    canonical = variation;
                }
            }
            for (String variation : variations) {
                if (!variation.equals(canonical)) {
                    suggestions.add(new AliasSuggestion(variation, canonical.toUpperCase(Locale.ROOT), EXACT_REASON));
                }
            }
        }
        return suggestions;
    }

    List<AliasSuggestion> keywordMatches(List<String> employers) {
        List<String> candidates = new ArrayList<>();
        Map<String, Set<String>> keyWords = new HashMap<>();
        for (String employer : employers) {
            if (employer.length() > MIN_KEYWORD_LENGTH) {
                candidates.add(employer);
                keyWords.put(employer, keyWords(employer));
            }
        }

        List<AliasSuggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            String first = candidates.get(i);
            if (keyWords.get(first).size() < MIN_KEY_WORDS) {
                continue;
            }
            for (int j = i + 1; j < candidates.size(); j++) {
                String second = candidates.get(j);
                if (keyWords.get(second).size() < MIN_KEY_WORDS) {
                    continue;
                }
                double score = similarity.compute(first, second);
                if (score >= minSimilarity) {
                    String canonical = first.length() >= second.length() ? first : second;
                    String raw = canonical.equals(first) ? second : first;
                    suggestions.add(new AliasSuggestion(raw, canonical.toUpperCase(Locale.ROOT),
                            KEYWORD_REASON_PREFIX + String.format(Locale.ROOT, "%.2f", score)));
                }
            }
        }
        return suggestions;
    }

    /**
     * Words of the comparison form longer than two characters.
     */
    Set<String> keyWords(String employer) {
        Set<String> words = new HashSet<>();
        for (String word : comparison.normalize(employer).split(" ")) {
            if (word.length() > 2) {
                words.add(word);
            }
        }
        return words;
    }
}
