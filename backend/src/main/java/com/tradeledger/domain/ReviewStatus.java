package com.tradeledger.domain;

public enum ReviewStatus {
    PENDING,
    RESOLVED,
    IGNORED
}
