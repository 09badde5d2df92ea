package com.tradeledger.domain;

public enum DiscrepancyKind {
    /** Reported by the exchange, absent from the ledger. */
    MISSING_TRADE,
    /** In the ledger, unknown to the exchange. Flagged for manual review, never removed. */
    EXTRA_TRADE,
    /** Present on both sides with differing quantity, price, fee or side. */
    AMOUNT_MISMATCH
}
