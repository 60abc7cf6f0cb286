package com.familyconnections.domain.model;

/**
 * Coarse summary of a connection score. Declaration order is rank order.
 */
public enum ConfidenceTier {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(ConfidenceTier other) {
        return compareTo(other) >= 0;
    }
}
