package com.salary.disclosure.rules;

import com.salary.disclosure.core.model.JobFamily;

import java.util.List;
import java.util.Locale;

/**
 * Classifies canonical job text into a {@link JobFamily} with ordered keyword rules.
 * The first rule with a matching keyword wins, so "POLICE MANAGER" is Police.
 */
public final class JobFamilyClassifier {

    private record KeywordRule(JobFamily family, List<String> keywords) {}

    private static final List<KeywordRule> RULES = List.of(
            new KeywordRule(JobFamily.ACADEMIC, List.of("professor")),
            new KeywordRule(JobFamily.EDUCATION, List.of("teacher", "principal")),
            new KeywordRule(JobFamily.MEDICAL, List.of("nurse")),
            new KeywordRule(JobFamily.MEDICAL, List.of("physician", "doctor")),
            new KeywordRule(JobFamily.POLICE, List.of("police", "constable", "detective")),
            new KeywordRule(JobFamily.FIRE, List.of("firefighter")),
            new KeywordRule(JobFamily.ENGINEERING, List.of("engineer")),
            new KeywordRule(JobFamily.MANAGEMENT, List.of("director")),
            new KeywordRule(JobFamily.MANAGEMENT, List.of("manager"))
    );

    private JobFamilyClassifier() {
        // Utility class
    }

    public static JobFamily classify(String canonicalTitle) {
        if (canonicalTitle == null || canonicalTitle.isEmpty()) {
            return JobFamily.OTHER;
        }
        String text = canonicalTitle.toLowerCase(Locale.ROOT);
        for (KeywordRule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (text.contains(keyword)) {
                    return rule.family();
                }
            }
        }
        return JobFamily.OTHER;
    }

    public static String familyLabel(String canonicalTitle) {
        return classify(canonicalTitle).getLabel();
    }
}
