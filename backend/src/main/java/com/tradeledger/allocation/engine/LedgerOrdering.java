package com.tradeledger.allocation.engine;

import com.tradeledger.domain.TradeRecord;

import java.util.Comparator;

/**
 * Total order over trade records of one symbol: exchange timestamp, then buys before sells, then order id.
 * Buys stamped at the same instant as a sell are therefore available to that sell.
 */
public final class LedgerOrdering {

    public static final Comparator<TradeRecord> FIFO = Comparator
            .comparing(TradeRecord::getExchangeTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(t -> t.isBuy() ? 0 : 1)
            .thenComparing(TradeRecord::getOrderId, Comparator.nullsLast(Comparator.naturalOrder()));

    private LedgerOrdering() {
    }
}
