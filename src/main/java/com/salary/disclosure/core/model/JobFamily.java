package com.salary.disclosure.core.model;

/**
 * Coarse occupational category inferred from canonical job text.
 */
public enum JobFamily {
    ACADEMIC("Academic"),
    EDUCATION("Education"),
    MEDICAL("Medical"),
    POLICE("Police"),
    FIRE("Fire"),
    ENGINEERING("Engineering"),
    MANAGEMENT("Management"),
    OTHER("Other");

    private final String label;

    JobFamily(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
