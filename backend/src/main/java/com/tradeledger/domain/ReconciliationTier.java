package com.tradeledger.domain;

/**
 * Reconciliation tiers in order of increasing strictness.
 */
public enum ReconciliationTier {
    /** Tier 1: order ids present on one side only. */
    PRESENCE(1),
    /** Tier 2: quantity, price, fee and side of orders present on both sides. */
    VALUE(2);

    private final int level;

    ReconciliationTier(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public static ReconciliationTier ofLevel(int level) {
        for (ReconciliationTier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown reconciliation tier " + level);
    }
}
