package com.tradeledger.domain;

public enum ReviewIssueType {
    UNMATCHED_SELL,
    EXTRA_TRADE,
    AMOUNT_MISMATCH
}
