package com.docsight.research.model;

/**
 * Coarse trust ranking derived from the source URL.
 */
public enum ConfidenceLevel {
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    UNVERIFIED(0);

    private final int weight;

    ConfidenceLevel(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
