package com.tradeledger.domain;

/**
 * How a trade record reached the ledger.
 */
public enum TradeSource {
    /** Live ingestion flow. */
    NORMAL,
    /** Inserted by the backfill coordinator after reconciliation found it missing. */
    BACKFILL
}
