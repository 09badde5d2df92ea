package com.tradeledger.backfill;

public enum BackfillStatus {
    /** The report had no missing trades. */
    NOTHING_TO_DO,
    /** Every missing trade is now in the ledger (inserted or already present). */
    COMPLETE,
    /** Some fetches or inserts failed; the rest is committed. */
    PARTIAL_FAILURE,
    /** Nothing could be backfilled. */
    FAILED
}
