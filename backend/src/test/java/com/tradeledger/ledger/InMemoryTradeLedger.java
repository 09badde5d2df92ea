package com.tradeledger.ledger;

import com.tradeledger.domain.TimeWindow;
import com.tradeledger.domain.TradeRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Append-only ledger backed by a list, with the same uniqueness and ordering rules as {@link MongoTradeLedger}.
 */
public class InMemoryTradeLedger implements TradeLedger {

    private static final Comparator<TradeRecord> ORDER = Comparator
            .comparing(TradeRecord::getExchangeTimestamp)
            .thenComparing(TradeRecord::getOrderId);

    private final List<TradeRecord> records = new ArrayList<>();
    private Runnable beforeNextScan;

    public InMemoryTradeLedger(TradeRecord... initial) {
        for (TradeRecord r : initial) {
            append(r);
        }
    }

    @Override
    public synchronized boolean append(TradeRecord record) {
        boolean exists = records.stream().anyMatch(r ->
                r.getOrderId().equals(record.getOrderId()) && r.getSymbol().equals(record.getSymbol()));
        if (exists) {
            return false;
        }
        records.add(record);
        return true;
    }

    /** Runs {@code action} once, at the start of the next {@link #scan}, as a concurrent writer would interleave. */
    public synchronized void beforeNextScan(Runnable action) {
        this.beforeNextScan = action;
    }

    @Override
    public synchronized List<TradeRecord> scan(Collection<String> symbols, Instant cutoff) {
        Runnable action = beforeNextScan;
        beforeNextScan = null;
        if (action != null) {
            action.run();
        }
        return records.stream()
                .filter(r -> symbols.isEmpty() || symbols.contains(r.getSymbol()))
                .filter(r -> !r.getIngestedAt().isAfter(cutoff))
                .sorted(ORDER)
                .toList();
    }

    @Override
    public synchronized List<TradeRecord> findInWindow(String symbol, TimeWindow window, Instant cutoff) {
        return records.stream()
                .filter(r -> r.getSymbol().equals(symbol))
                .filter(r -> window.contains(r.getExchangeTimestamp()))
                .filter(r -> !r.getIngestedAt().isAfter(cutoff))
                .sorted(ORDER)
                .toList();
    }

    @Override
    public synchronized Set<String> distinctSymbols(Instant cutoff) {
        return records.stream()
                .filter(r -> !r.getIngestedAt().isAfter(cutoff))
                .map(TradeRecord::getSymbol)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public synchronized int size() {
        return records.size();
    }
}
