package com.salary.disclosure.quality;

/**
 * How urgently a data-quality issue needs operator attention.
 */
public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    INFO("info");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
