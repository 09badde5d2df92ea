package com.tradeledger.allocation.validation;

public enum ViolationCode {
    /** Matched (plus residue) quantity of a sell exceeds the sell's quantity. */
    SELL_OVER_ALLOCATED,
    /** Matched plus residue quantity of a sell is below the sell's quantity: quantity was dropped. */
    SELL_UNDER_ALLOCATED,
    /** One allocation is larger than its buy or its sell. */
    ALLOCATION_EXCEEDS_PARENT,
    NON_POSITIVE_ALLOCATION,
    /** Allocations of a buy add up to more than the buy's quantity. */
    BUY_OVER_CONSUMED,
    /** A later buy was consumed while an earlier eligible buy still had quantity. */
    FIFO_ORDER_VIOLATION,
    /** Buy executed after the sell it funds. */
    TEMPORAL_VIOLATION,
    DUPLICATE_ALLOCATION,
    /** Allocation or residue points at an order missing from the scope, or at the wrong side. */
    UNKNOWN_TRADE_REFERENCE,
    /** Open lot inventory does not equal buy quantity minus consumed quantity. */
    OPEN_LOT_MISMATCH,
    NEGATIVE_OPEN_LOT,
    /** Warning: sell quantity without buy history. */
    UNMATCHED_SELL_RESIDUE
}
