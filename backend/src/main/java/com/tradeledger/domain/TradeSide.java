package com.tradeledger.domain;

public enum TradeSide {
    BUY,
    SELL
}
