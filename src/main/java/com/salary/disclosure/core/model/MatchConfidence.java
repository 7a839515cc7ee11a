package com.salary.disclosure.core.model;

/**
 * Confidence attached to an accepted person link.
 * The linking rules are strict and ungraded, so every accepted link is {@link #HIGH}.
 */
public enum MatchConfidence {
    HIGH("High");

    private final String label;

    MatchConfidence(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
