package com.salary.disclosure.rules;

import java.util.List;

/**
 * The two shipped canonicalizer configurations: employer names and job titles.
 * Both run on upper-cased text.
 */
public final class CanonicalizationRules {

    public static final String EMPLOYER = "employer";
    public static final String JOB_TITLE = "job-title";
    public static final String COMPARISON = "comparison";

    private static final String BOILERPLATE =
            "\\b(INC|LTD|LIMITED|CORP|CORPORATION|THE|OF|AND)\\b";

    private CanonicalizationRules() {
        // Utility class
    }

    public static StringCanonicalizer employer() {
        return new StringCanonicalizer(EMPLOYER, getEmployerRules());
    }

    public static StringCanonicalizer jobTitle() {
        return new StringCanonicalizer(JOB_TITLE, getJobTitleRules());
    }

    /**
     * Looser employer form used only to compare raw strings when suggesting aliases.
     * Boilerplate words are removed without leaving a separator.
     */
    public static StringCanonicalizer comparison() {
        return new StringCanonicalizer(COMPARISON, List.of(
                NormalizationRule.builder()
                        .name("comparison-boilerplate")
                        .pattern(BOILERPLATE)
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("comparison-special-chars")
                        .pattern("[^A-Z0-9\\s]")
                        .replacement("")
                        .caseInsensitive(false)
                        .priority(100)
                        .build()
        ));
    }

    /**
     * Employer rules: strip legal-entity boilerplate words, drop everything outside
     * [A-Z0-9] and whitespace. Boilerplate is stripped again after the character drop
     * so that words joined by removed punctuation ("I.N.C") cannot surface on a
     * second pass.
     */
    public static List<NormalizationRule> getEmployerRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("employer-boilerplate")
                        .pattern(BOILERPLATE)
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("employer-special-chars")
                        .pattern("[^A-Z0-9\\s]")
                        .replacement("")
                        .caseInsensitive(false)
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("employer-boilerplate-residual")
                        .pattern(BOILERPLATE)
                        .replacement(" ")
                        .priority(110)
                        .build()
        );
    }

    /**
     * Job-title rules: commas become spaces, spaced dashes become one space, spaced
     * slashes tighten to "/", then everything outside [A-Z0-9], whitespace and "/" is
     * dropped.
     */
    public static List<NormalizationRule> getJobTitleRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("job-comma")
                        .pattern(",")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("job-spaced-dash")
                        .pattern("\\s+-\\s+")
                        .replacement(" ")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("job-spaced-slash")
                        .pattern("\\s+/\\s+")
                        .replacement("/")
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("job-special-chars")
                        .pattern("[^A-Z0-9\\s/]")
                        .replacement("")
                        .caseInsensitive(false)
                        .priority(100)
                        .build(),

                // Dropped characters can leave a slash spaced on both sides
                NormalizationRule.builder()
                        .name("job-spaced-slash-residual")
                        .pattern("\\s+/\\s+")
                        .replacement("/")
                        .priority(110)
                        .build()
        );
    }
}
