package com.tradeledger.allocation.validation;

import com.tradeledger.allocation.engine.LedgerOrdering;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.TradeSide;
import com.tradeledger.domain.UnmatchedSellResidue;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structural checks of a computed allocation version against the ledger scope it was computed from:
 * conservation of quantity per sell and per buy, FIFO consumption order, temporal order, duplicate pairs and
 * the open lot inventory. Unmatched sell residues are warnings, not errors.
 */
@Component
public class AllocationValidator {

    public ValidationResult validate(
            String namespace,
            long versionNumber,
            List<TradeRecord> scope,
            List<FifoAllocation> allocations,
            List<UnmatchedSellResidue> residues,
            List<OpenLot> openLots
    ) {
        List<Violation> errors = new ArrayList<>();
        List<Violation> warnings = new ArrayList<>();

        Map<String, SymbolScope> symbols = new TreeMap<>();
        for (TradeRecord trade : scope) {
            symbols.computeIfAbsent(trade.getSymbol(), SymbolScope::new).trades.put(trade.getOrderId(), trade);
        }
        for (FifoAllocation allocation : allocations) {
            scopeOf(symbols, allocation.getSymbol()).allocations.add(allocation);
        }
        for (UnmatchedSellResidue residue : residues) {
            scopeOf(symbols, residue.getSymbol()).residues.add(residue);
        }
        for (OpenLot lot : openLots) {
            scopeOf(symbols, lot.getSymbol()).openLots.add(lot);
        }

        for (SymbolScope symbol : symbols.values()) {
            symbol.check(errors, warnings);
        }
        return new ValidationResult(namespace, versionNumber, errors, warnings);
    }

    private static SymbolScope scopeOf(Map<String, SymbolScope> symbols, String symbol) {
        return symbols.computeIfAbsent(symbol, SymbolScope::new);
    }

    private static final class SymbolScope {

        private final String symbol;
        private final Map<String, TradeRecord> trades = new TreeMap<>();
        private final List<FifoAllocation> allocations = new ArrayList<>();
        private final List<UnmatchedSellResidue> residues = new ArrayList<>();
        private final List<OpenLot> openLots = new ArrayList<>();

        SymbolScope(String symbol) {
            this.symbol = symbol;
        }

        void check(List<Violation> errors, List<Violation> warnings) {
            Map<String, BigDecimal> matchedBySell = new HashMap<>();
            Map<String, BigDecimal> residueBySell = new HashMap<>();
            Map<String, BigDecimal> consumedByBuy = new HashMap<>();
            Set<String> pairs = new HashSet<>();
            List<FifoAllocation> consistent = new ArrayList<>();

            for (FifoAllocation a : allocations) {
                TradeRecord buy = trades.get(a.getBuyOrderId());
                TradeRecord sell = trades.get(a.getSellOrderId());
                if (buy == null || buy.getSide() != TradeSide.BUY || sell == null || sell.getSide() != TradeSide.SELL) {
                    errors.add(new Violation(ViolationCode.UNKNOWN_TRADE_REFERENCE, symbol, a.getSellOrderId(),
                            "allocation #" + a.getSequence() + " references buy " + a.getBuyOrderId()
                                    + " / sell " + a.getSellOrderId() + " not in scope with the expected sides"));
                    continue;
                }
                BigDecimal qty = a.getQuantity();
                if (qty == null || qty.signum() <= 0) {
                    errors.add(new Violation(ViolationCode.NON_POSITIVE_ALLOCATION, symbol, a.getSellOrderId(),
                            "allocation #" + a.getSequence() + " has quantity " + qty));
                    continue;
                }
                if (qty.compareTo(buy.getQuantity()) > 0 || qty.compareTo(sell.getQuantity()) > 0) {
                    errors.add(new Violation(ViolationCode.ALLOCATION_EXCEEDS_PARENT, symbol, a.getSellOrderId(),
                            "allocation #" + a.getSequence() + " of " + qty.toPlainString() + " exceeds buy "
                                    + buy.getQuantity().toPlainString() + " or sell " + sell.getQuantity().toPlainString()));
                }
                if (!pairs.add(a.getSellOrderId() + "->" + a.getBuyOrderId())) {
                    errors.add(new Violation(ViolationCode.DUPLICATE_ALLOCATION, symbol, a.getSellOrderId(),
                            "sell matched against buy " + a.getBuyOrderId() + " more than once"));
                }
                if (buy.getExchangeTimestamp().isAfter(sell.getExchangeTimestamp())) {
                    errors.add(new Violation(ViolationCode.TEMPORAL_VIOLATION, symbol, a.getSellOrderId(),
                            "buy " + buy.getOrderId() + " at " + buy.getExchangeTimestamp()
                                    + " is after sell at " + sell.getExchangeTimestamp()));
                }
                matchedBySell.merge(sell.getOrderId(), qty, BigDecimal::add);
                consumedByBuy.merge(buy.getOrderId(), qty, BigDecimal::add);
                consistent.add(a);
            }

            for (UnmatchedSellResidue r : residues) {
                TradeRecord sell = trades.get(r.getSellOrderId());
                if (sell == null || sell.getSide() != TradeSide.SELL) {
                    errors.add(new Violation(ViolationCode.UNKNOWN_TRADE_REFERENCE, symbol, r.getSellOrderId(),
                            "residue #" + r.getSequence() + " references a sell not in scope"));
                    continue;
                }
                residueBySell.merge(sell.getOrderId(), r.getQuantity(), BigDecimal::add);
                warnings.add(new Violation(ViolationCode.UNMATCHED_SELL_RESIDUE, symbol, r.getSellOrderId(),
                        r.getQuantity().toPlainString() + " units sold without buy history"));
            }

            List<TradeRecord> buys = new ArrayList<>();
            for (TradeRecord trade : trades.values()) {
                if (trade.getSide() == TradeSide.BUY) {
                    buys.add(trade);
                } else {
                    checkSellConservation(trade, matchedBySell, residueBySell, errors);
                }
            }
            buys.sort(LedgerOrdering.FIFO);

            Map<String, BigDecimal> expectedOpen = new HashMap<>();
            for (TradeRecord buy : buys) {
                BigDecimal consumed = consumedByBuy.getOrDefault(buy.getOrderId(), BigDecimal.ZERO);
                BigDecimal remaining = buy.getQuantity().subtract(consumed);
                if (remaining.signum() < 0) {
                    errors.add(new Violation(ViolationCode.BUY_OVER_CONSUMED, symbol, buy.getOrderId(),
                            "consumed " + consumed.toPlainString() + " of " + buy.getQuantity().toPlainString()));
                } else if (remaining.signum() > 0) {
                    expectedOpen.put(buy.getOrderId(), remaining);
                }
            }

            checkFifoOrder(buys, consistent, errors);
            checkOpenLots(expectedOpen, errors);
        }

        private void checkSellConservation(TradeRecord sell, Map<String, BigDecimal> matchedBySell,
                                           Map<String, BigDecimal> residueBySell, List<Violation> errors) {
            BigDecimal matched = matchedBySell.getOrDefault(sell.getOrderId(), BigDecimal.ZERO);
            BigDecimal residue = residueBySell.getOrDefault(sell.getOrderId(), BigDecimal.ZERO);
            BigDecimal accounted = matched.add(residue);
            int cmp = accounted.compareTo(sell.getQuantity());
            if (matched.compareTo(sell.getQuantity()) > 0 || cmp > 0) {
                errors.add(new Violation(ViolationCode.SELL_OVER_ALLOCATED, symbol, sell.getOrderId(),
                        "matched " + matched.toPlainString() + " + residue " + residue.toPlainString()
                                + " exceeds quantity " + sell.getQuantity().toPlainString()));
            } else if (cmp < 0) {
                errors.add(new Violation(ViolationCode.SELL_UNDER_ALLOCATED, symbol, sell.getOrderId(),
                        "matched " + matched.toPlainString() + " + residue " + residue.toPlainString()
                                + " is below quantity " + sell.getQuantity().toPlainString()));
            }
        }

        /**
         * Replays consumption in allocation order; the buy consumed must be the earliest buy with quantity left,
         * unless that buy is not yet eligible for the sell.
         */
        private void checkFifoOrder(List<TradeRecord> buys, List<FifoAllocation> ordered, List<Violation> errors) {
            Map<String, Integer> indexOf = new HashMap<>();
            BigDecimal[] remaining = new BigDecimal[buys.size()];
            for (int i = 0; i < buys.size(); i++) {
                indexOf.put(buys.get(i).getOrderId(), i);
                remaining[i] = buys.get(i).getQuantity();
            }
            int firstOpen = 0;
            for (FifoAllocation a : ordered) {
                while (firstOpen < remaining.length && remaining[firstOpen].signum() <= 0) {
                    firstOpen++;
                }
                int idx = indexOf.get(a.getBuyOrderId());
                TradeRecord sell = trades.get(a.getSellOrderId());
                if (firstOpen < idx && LedgerOrdering.FIFO.compare(buys.get(firstOpen), sell) < 0) {
                    errors.add(new Violation(ViolationCode.FIFO_ORDER_VIOLATION, symbol, a.getSellOrderId(),
                            "consumed buy " + a.getBuyOrderId() + " while earlier buy " + buys.get(firstOpen).getOrderId()
                                    + " had " + remaining[firstOpen].toPlainString() + " open"));
                }
                remaining[idx] = remaining[idx].subtract(a.getQuantity());
            }
        }

        private void checkOpenLots(Map<String, BigDecimal> expectedOpen, List<Violation> errors) {
            Map<String, BigDecimal> reported = new HashMap<>();
            for (OpenLot lot : openLots) {
                if (lot.getRemainingQuantity() == null || lot.getRemainingQuantity().signum() < 0) {
                    errors.add(new Violation(ViolationCode.NEGATIVE_OPEN_LOT, symbol, lot.getBuyOrderId(),
                            "open lot remaining " + lot.getRemainingQuantity()));
                    continue;
                }
                reported.merge(lot.getBuyOrderId(), lot.getRemainingQuantity(), BigDecimal::add);
            }
            Set<String> buyIds = new TreeSet<>(expectedOpen.keySet());
            buyIds.addAll(reported.keySet());
            for (String buyId : buyIds) {
                BigDecimal expected = expectedOpen.getOrDefault(buyId, BigDecimal.ZERO);
                BigDecimal actual = reported.getOrDefault(buyId, BigDecimal.ZERO);
                if (expected.compareTo(actual) != 0) {
                    errors.add(new Violation(ViolationCode.OPEN_LOT_MISMATCH, symbol, buyId,
                            "open lot " + actual.toPlainString() + " but buy has " + expected.toPlainString() + " unconsumed"));
                }
            }
        }
    }
}
