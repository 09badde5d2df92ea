package com.tradeledger.ledger;

import com.tradeledger.domain.TimeWindow;
import com.tradeledger.domain.TradeRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Append-only store of normalized trade records. Existing rows are never updated or removed.
 */
public interface TradeLedger {

    /**
     * Inserts the record unless a row with the same (orderId, symbol) exists.
     *
     * @return true when inserted, false when the row was already present (no-op)
     */
    boolean append(TradeRecord record);

    /**
     * Records of the given symbols with ingestedAt &lt;= cutoff, ordered by (exchangeTimestamp, orderId).
     * An empty symbol set means every symbol.
     */
    List<TradeRecord> scan(Collection<String> symbols, Instant cutoff);

    /** Records of one symbol whose exchange timestamp falls in the window, ingested at or before cutoff. */
    List<TradeRecord> findInWindow(String symbol, TimeWindow window, Instant cutoff);

    /** Symbols with at least one record ingested at or before cutoff, sorted. */
    Set<String> distinctSymbols(Instant cutoff);
}
