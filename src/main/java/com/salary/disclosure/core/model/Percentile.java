package com.salary.disclosure.core.model;

/**
 * Fixed quantile probabilities used by the distribution reports.
 */
public enum Percentile {
    P50(0.50, "p50"),
    P75(0.75, "p75"),
    P90(0.90, "p90"),
    P95(0.95, "p95"),
    P99(0.99, "p99");

    private final double probability;
    private final String label;

    Percentile(double probability, String label) {
        this.probability = probability;
        this.label = label;
    }

    public double getProbability() {
        return probability;
    }

    public String getLabel() {
        return label;
    }
}
