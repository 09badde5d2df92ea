package com.tradeledger.domain;

public enum AllocationRunMode {
    /** Every symbol in the ledger snapshot. */
    FULL,
    /** Explicit symbols; other symbols are carried forward from the based-on version. */
    SCOPED
}
