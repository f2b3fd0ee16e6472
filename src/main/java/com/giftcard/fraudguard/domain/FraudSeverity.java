package com.giftcard.fraudguard.domain;

/**
 * Severity of a single fraud log row.
 */
public enum FraudSeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int weight;

    FraudSeverity(int weight) {
        this.weight = weight;
    }

    /** Numeric weight used by the cluster scorer's severity-mix term. */
    public int getWeight() {
        return weight;
    }
}
