package com.tradeledger.allocation.engine;

import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.UnmatchedSellResidue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * FIFO lot matching over a ledger snapshot. Symbols are processed independently in sorted order; within a symbol
 * records follow {@link LedgerOrdering#FIFO}. Each sell consumes the oldest open buy lots; quantity that finds no
 * lot becomes an {@link UnmatchedSellResidue}, never a fabricated buy.
 * <p>
 * The engine is a pure function of its input: no clock, no I/O, no hash-ordered iteration in the matching loop.
 * Quantity arithmetic is exact; fee shares are pro-rata at scale 18 (HALF_EVEN), with the last slice of an order
 * taking the remainder so the shares of a fully matched order sum to its fee.
 */
@Component
@Slf4j
public class FifoAllocationEngine {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    public AllocationComputation allocate(String namespace, long versionNumber, List<TradeRecord> snapshot) {
        Map<String, List<TradeRecord>> bySymbol = new TreeMap<>();
        for (TradeRecord record : snapshot) {
            bySymbol.computeIfAbsent(record.getSymbol(), k -> new ArrayList<>()).add(record);
        }

        Run run = new Run(namespace, versionNumber);
        for (Map.Entry<String, List<TradeRecord>> entry : bySymbol.entrySet()) {
            List<TradeRecord> ordered = new ArrayList<>(entry.getValue());
            ordered.sort(LedgerOrdering.FIFO);
            run.matchSymbol(entry.getKey(), ordered);
        }

        return new AllocationComputation(
                Collections.unmodifiableSet(new TreeSet<>(bySymbol.keySet())),
                List.copyOf(run.allocations),
                List.copyOf(run.residues),
                List.copyOf(run.openLots),
                run.buys,
                run.sells,
                run.totalRealizedPnl);
    }

    private static final class Run {

        private final String namespace;
        private final long versionNumber;
        private final List<FifoAllocation> allocations = new ArrayList<>();
        private final List<UnmatchedSellResidue> residues = new ArrayList<>();
        private final List<OpenLot> openLots = new ArrayList<>();
        private final Map<String, FeeShares> feeSharesByOrder = new HashMap<>();
        private int sequence;
        private int buys;
        private int sells;
        private BigDecimal totalRealizedPnl = BigDecimal.ZERO;

        Run(String namespace, long versionNumber) {
            this.namespace = namespace;
            this.versionNumber = versionNumber;
        }

        void matchSymbol(String symbol, List<TradeRecord> ordered) {
            Deque<LotCursor> queue = new ArrayDeque<>();
            for (TradeRecord trade : ordered) {
                if (trade.isBuy()) {
                    buys++;
                    if (trade.getQuantity().signum() > 0) {
                        queue.addLast(new LotCursor(trade));
                    }
                    continue;
                }
                sells++;
                BigDecimal unmatched = trade.getQuantity();
                while (unmatched.signum() > 0 && !queue.isEmpty()) {
                    LotCursor lot = queue.peekFirst();
                    BigDecimal matched = unmatched.min(lot.remaining);
                    allocations.add(allocation(lot.buy, trade, matched));
                    lot.remaining = lot.remaining.subtract(matched);
                    unmatched = unmatched.subtract(matched);
                    if (lot.remaining.signum() == 0) {
                        queue.pollFirst();
                    }
                }
                if (unmatched.signum() > 0) {
                    log.warn("Sell {} of {} has {} units without an open buy lot", trade.getOrderId(), symbol, unmatched.toPlainString());
                    residues.add(residue(trade, unmatched));
                }
            }
            for (LotCursor lot : queue) {
                openLots.add(openLot(lot));
            }
        }

        private FifoAllocation allocation(TradeRecord buy, TradeRecord sell, BigDecimal quantity) {
            BigDecimal buyFeeShare = feeShare(buy, quantity);
            BigDecimal sellFeeShare = feeShare(sell, quantity);
            BigDecimal costBasis = buy.getPrice().multiply(quantity).add(buyFeeShare);
            BigDecimal proceeds = sell.getPrice().multiply(quantity);
            BigDecimal netProceeds = proceeds.subtract(sellFeeShare);
            BigDecimal realizedPnl = netProceeds.subtract(costBasis);
            totalRealizedPnl = totalRealizedPnl.add(realizedPnl);

            FifoAllocation a = new FifoAllocation();
            a.setNamespace(namespace);
            a.setVersionNumber(versionNumber);
            a.setSequence(sequence++);
            a.setSymbol(sell.getSymbol());
            a.setSellOrderId(sell.getOrderId());
            a.setBuyOrderId(buy.getOrderId());
            a.setQuantity(quantity);
            a.setBuyPrice(buy.getPrice());
            a.setSellPrice(sell.getPrice());
            a.setBuyFeeShare(buyFeeShare);
            a.setSellFeeShare(sellFeeShare);
            a.setCostBasis(costBasis);
            a.setProceeds(proceeds);
            a.setNetProceeds(netProceeds);
            a.setRealizedPnl(realizedPnl);
            a.setBuyTime(buy.getExchangeTimestamp());
            a.setSellTime(sell.getExchangeTimestamp());
            return a;
        }

        private UnmatchedSellResidue residue(TradeRecord sell, BigDecimal quantity) {
            BigDecimal sellFeeShare = feeShare(sell, quantity);
            BigDecimal proceeds = sell.getPrice().multiply(quantity);

            UnmatchedSellResidue r = new UnmatchedSellResidue();
            r.setNamespace(namespace);
            r.setVersionNumber(versionNumber);
            r.setSequence(sequence++);
            r.setSymbol(sell.getSymbol());
            r.setSellOrderId(sell.getOrderId());
            r.setQuantity(quantity);
            r.setSellPrice(sell.getPrice());
            r.setSellFeeShare(sellFeeShare);
            r.setProceeds(proceeds);
            r.setNetProceeds(proceeds.subtract(sellFeeShare));
            r.setSellTime(sell.getExchangeTimestamp());
            r.setNote("UNMATCHED: no open buy lot for " + quantity.toPlainString() + " " + sell.getSymbol());
            return r;
        }

        private OpenLot openLot(LotCursor lot) {
            OpenLot o = new OpenLot();
            o.setNamespace(namespace);
            o.setVersionNumber(versionNumber);
            o.setSymbol(lot.buy.getSymbol());
            o.setBuyOrderId(lot.buy.getOrderId());
            o.setOriginalQuantity(lot.buy.getQuantity());
            o.setRemainingQuantity(lot.remaining);
            o.setBuyPrice(lot.buy.getPrice());
            o.setBuyTime(lot.buy.getExchangeTimestamp());
            return o;
        }

        private BigDecimal feeShare(TradeRecord order, BigDecimal quantity) {
            FeeShares shares = feeSharesByOrder.computeIfAbsent(order.getSymbol() + '\u0000' + order.getOrderId(), k -> new FeeShares());
            return shares.take(order.feeOrZero(), order.getQuantity(), quantity);
        }
    }

    private static final class LotCursor {
        private final TradeRecord buy;
        private BigDecimal remaining;

        LotCursor(TradeRecord buy) {
            this.buy = buy;
            this.remaining = buy.getQuantity();
        }
    }

    /** Running fee allocation of one order across its slices. */
    private static final class FeeShares {
        private BigDecimal quantityTaken = BigDecimal.ZERO;
        private BigDecimal feeTaken = BigDecimal.ZERO;

        BigDecimal take(BigDecimal fee, BigDecimal orderQuantity, BigDecimal slice) {
            quantityTaken = quantityTaken.add(slice);
            BigDecimal share;
            if (quantityTaken.compareTo(orderQuantity) >= 0) {
                share = fee.subtract(feeTaken);
            } else {
                share = fee.multiply(slice).divide(orderQuantity, SCALE, ROUNDING);
            }
            feeTaken = feeTaken.add(share);
            return share;
        }
    }
}
