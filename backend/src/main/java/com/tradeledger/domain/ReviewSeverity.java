package com.tradeledger.domain;

public enum ReviewSeverity {
    LOW,
    MEDIUM,
    HIGH
}
