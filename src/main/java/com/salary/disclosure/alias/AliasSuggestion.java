package com.salary.disclosure.alias;

import java.util.Objects;

/**
 * A proposed alias-table row for operator review.
 *
 * @param raw       raw employer string as published
 * @param canonical proposed canonical string
 * @param reason    {@code exact_normalized_match} or {@code keyword_similarity_<score>}
 */
public record AliasSuggestion(String raw, String canonical, String reason) {
    public AliasSuggestion {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(canonical, "canonical is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
