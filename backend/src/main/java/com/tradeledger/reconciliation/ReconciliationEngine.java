package com.tradeledger.reconciliation;

import com.tradeledger.domain.Discrepancy;
import com.tradeledger.domain.DiscrepancyKind;
import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.ReconciliationReport;
import com.tradeledger.domain.ReconciliationTier;
import com.tradeledger.domain.TimeWindow;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares ledger records with exchange fills, one tier at a time. Pure: inputs are an already fetched external
 * snapshot and ledger rows read at the snapshot cutoff; nothing is written.
 */
@Slf4j
@Component
public class ReconciliationEngine {

    /**
     * Tier 1. External order ids absent locally are MISSING_TRADE, local ids absent externally are EXTRA_TRADE.
     */
    public List<Discrepancy> presence(String symbol, List<TradeRecord> local, List<RawFill> external) {
        Map<String, TradeRecord> localById = indexLocal(local);
        Map<String, RawFill> externalById = indexExternal(external);
        List<Discrepancy> out = new ArrayList<>();
        for (RawFill fill : external) {
            if (hasOrderId(fill) && !localById.containsKey(fill.orderId())) {
                out.add(missing(symbol, fill));
            }
        }
        for (TradeRecord record : local) {
            if (!externalById.containsKey(record.getOrderId())) {
                out.add(extra(symbol, record));
            }
        }
        return out;
    }

    /**
     * Tier 2. For order ids on both sides, quantity, price and fee beyond {@code tolerance}, or a different side,
     * yield one AMOUNT_MISMATCH naming every differing field.
     */
    public List<Discrepancy> value(String symbol, List<TradeRecord> local, List<RawFill> external, BigDecimal tolerance) {
        Map<String, RawFill> externalById = indexExternal(external);
        List<Discrepancy> out = new ArrayList<>();
        for (TradeRecord record : local) {
            RawFill fill = externalById.get(record.getOrderId());
            if (fill == null) {
                continue;
            }
            Discrepancy d = new Discrepancy();
            BigDecimal externalFee = fill.fee() != null ? fill.fee() : BigDecimal.ZERO;
            if (differs(record.getQuantity(), fill.quantity(), tolerance)) {
                d.getMismatchedFields().add("quantity");
                d.setQuantityDelta(delta(fill.quantity(), record.getQuantity()));
            }
            if (differs(record.getPrice(), fill.price(), tolerance)) {
                d.getMismatchedFields().add("price");
                d.setPriceDelta(delta(fill.price(), record.getPrice()));
            }
            if (differs(record.feeOrZero(), externalFee, tolerance)) {
                d.getMismatchedFields().add("fee");
                d.setFeeDelta(delta(externalFee, record.feeOrZero()));
            }
            TradeSide externalSide = parseSide(fill.side());
            if (externalSide != record.getSide()) {
                d.getMismatchedFields().add("side");
            }
            if (d.getMismatchedFields().isEmpty()) {
                continue;
            }
            d.setKind(DiscrepancyKind.AMOUNT_MISMATCH);
            d.setSymbol(symbol);
            d.getOrderIds().add(record.getOrderId());
            d.setSide(record.getSide());
            d.setExchangeTimestamp(record.getExchangeTimestamp());
            d.setLocalQuantity(record.getQuantity());
            d.setExternalQuantity(fill.quantity());
            d.setLocalPrice(record.getPrice());
            d.setExternalPrice(fill.price());
            d.setLocalFee(record.feeOrZero());
            d.setExternalFee(externalFee);
            out.add(d);
        }
        return out;
    }

    /**
     * Runs one tier over every symbol of the scope and assembles the report.
     */
    public ReconciliationReport report(
            String runId,
            String namespace,
            ReconciliationTier tier,
            TimeWindow window,
            Instant snapshotCutoff,
            Instant createdAt,
            Map<String, List<TradeRecord>> localBySymbol,
            Map<String, List<RawFill>> externalBySymbol,
            BigDecimal tolerance
    ) {
        ReconciliationReport report = new ReconciliationReport();
        report.setRunId(runId);
        report.setNamespace(namespace);
        report.setTier(tier);
        report.setWindowFrom(window.from());
        report.setWindowTo(window.to());
        report.setSnapshotCutoff(snapshotCutoff);
        report.setCreatedAt(createdAt);

        Map<String, List<TradeRecord>> local = new TreeMap<>(localBySymbol);
        int localCount = 0;
        int externalCount = 0;
        for (String symbol : new TreeMap<>(externalBySymbol).keySet()) {
            List<TradeRecord> localRows = local.getOrDefault(symbol, List.of());
            List<RawFill> externalRows = externalBySymbol.get(symbol);
            localCount += localRows.size();
            externalCount += externalRows.size();
            report.getSymbols().add(symbol);
            report.getDiscrepancies().addAll(tier == ReconciliationTier.PRESENCE
                    ? presence(symbol, localRows, externalRows)
                    : value(symbol, localRows, externalRows, tolerance));
        }
        report.setLocalOrderCount(localCount);
        report.setExternalOrderCount(externalCount);
        return report;
    }

    private static Discrepancy missing(String symbol, RawFill fill) {
        Discrepancy d = new Discrepancy();
        d.setKind(DiscrepancyKind.MISSING_TRADE);
        d.setSymbol(symbol);
        d.getOrderIds().add(fill.orderId());
        d.setSide(parseSide(fill.side()));
        d.setExchangeTimestamp(fill.tradeTime());
        d.setExternalQuantity(fill.quantity());
        d.setExternalPrice(fill.price());
        d.setExternalFee(fill.fee());
        d.setQuantityDelta(fill.quantity());
        return d;
    }

    private static Discrepancy extra(String symbol, TradeRecord record) {
        Discrepancy d = new Discrepancy();
        d.setKind(DiscrepancyKind.EXTRA_TRADE);
        d.setSymbol(symbol);
        d.getOrderIds().add(record.getOrderId());
        d.setSide(record.getSide());
        d.setExchangeTimestamp(record.getExchangeTimestamp());
        d.setLocalQuantity(record.getQuantity());
        d.setLocalPrice(record.getPrice());
        d.setLocalFee(record.getFee());
        d.setQuantityDelta(record.getQuantity().negate());
        return d;
    }

    private static Map<String, TradeRecord> indexLocal(List<TradeRecord> local) {
        Map<String, TradeRecord> byId = new TreeMap<>();
        for (TradeRecord record : local) {
            byId.put(record.getOrderId(), record);
        }
        return byId;
    }

    private static Map<String, RawFill> indexExternal(List<RawFill> external) {
        Map<String, RawFill> byId = new TreeMap<>();
        for (RawFill fill : external) {
            if (hasOrderId(fill)) {
                byId.put(fill.orderId(), fill);
            }
        }
        return byId;
    }

    // Sources that parse their own payloads reject id-less fills; anything else is not comparable by order.
    private static boolean hasOrderId(RawFill fill) {
        if (fill.orderId() == null || fill.orderId().isBlank()) {
            log.warn("Ignoring external fill without order id (trade {}, symbol {})", fill.tradeId(), fill.symbol());
            return false;
        }
        return true;
    }

    private static boolean differs(BigDecimal local, BigDecimal external, BigDecimal tolerance) {
        if (local == null || external == null) {
            return local != external;
        }
        return local.subtract(external).abs().compareTo(tolerance) > 0;
    }

    private static BigDecimal delta(BigDecimal external, BigDecimal local) {
        if (external == null || local == null) {
            return null;
        }
        return external.subtract(local);
    }

    private static TradeSide parseSide(String side) {
        if (side == null) {
            return null;
        }
        try {
            return TradeSide.valueOf(side.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
