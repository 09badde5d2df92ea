package com.tradeledger.backfill;

/**
 * A missing trade left for a later retry.
 */
public record BackfillFailure(String orderId, String symbol, Reason reason, String message) {

    public enum Reason {
        SOURCE_UNAVAILABLE,
        /** The exchange definitively does not know the order. */
        NOT_FOUND,
        INVALID_FILL,
        /** The fetched fill belongs to another symbol than the discrepancy. */
        SYMBOL_MISMATCH
    }
}
