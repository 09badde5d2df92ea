package com.tradeledger.backfill;

import com.tradeledger.domain.AllocationRecomputeRequestedEvent;
import com.tradeledger.domain.Discrepancy;
import com.tradeledger.domain.DiscrepancyKind;
import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.ReconciliationReport;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.TradeSource;
import com.tradeledger.exchange.ExchangeFillSource;
import com.tradeledger.exchange.SourceUnavailableException;
import com.tradeledger.ledger.InvalidFillException;
import com.tradeledger.ledger.TradeLedger;
import com.tradeledger.ledger.TradeRecordNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inserts the MissingTrade entries of a reconciliation report into the ledger as BACKFILL records. Each fill is
 * fetched on its own so one failure does not block the others. Inserting an order already present is a no-op,
 * so a pass can be re-run after a partial failure. When anything was inserted a scoped recompute is requested
 * for the affected symbols; allocations are not computed here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BackfillCoordinator {

    public static final String TRIGGER = "backfill";

    private final ExchangeFillSource exchangeFillSource;
    private final TradeRecordNormalizer normalizer;
    private final TradeLedger tradeLedger;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public BackfillResult backfill(ReconciliationReport report) {
        return backfill(report.getNamespace(), report.discrepanciesOf(DiscrepancyKind.MISSING_TRADE));
    }

    public BackfillResult backfill(String namespace, List<Discrepancy> discrepancies) {
        List<Discrepancy> missing = discrepancies.stream()
                .filter(d -> d.getKind() == DiscrepancyKind.MISSING_TRADE)
                .filter(d -> d.primaryOrderId() != null)
                .toList();
        if (missing.isEmpty()) {
            return BackfillResult.nothingToDo(namespace);
        }

        List<String> inserted = new ArrayList<>();
        List<String> alreadyPresent = new ArrayList<>();
        List<BackfillFailure> failed = new ArrayList<>();
        Set<String> affectedSymbols = new TreeSet<>();
        Instant ingestedUpTo = null;

        for (Discrepancy discrepancy : missing) {
            String orderId = discrepancy.primaryOrderId();
            String symbol = discrepancy.getSymbol();
            Optional<RawFill> fill;
            try {
                fill = exchangeFillSource.getFill(orderId);
            } catch (SourceUnavailableException e) {
                log.warn("Backfill fetch of {} failed: {}", orderId, e.getMessage());
                failed.add(new BackfillFailure(orderId, symbol, BackfillFailure.Reason.SOURCE_UNAVAILABLE, e.getMessage()));
                continue;
            }
            if (fill.isEmpty()) {
                failed.add(new BackfillFailure(orderId, symbol, BackfillFailure.Reason.NOT_FOUND,
                        "Exchange does not know order " + orderId));
                continue;
            }
            TradeRecord record;
            try {
                record = normalizer.normalize(fill.get(), TradeSource.BACKFILL, clock.instant());
            } catch (InvalidFillException e) {
                failed.add(new BackfillFailure(orderId, symbol, BackfillFailure.Reason.INVALID_FILL, e.getMessage()));
                continue;
            }
            if (symbol != null && !symbol.equalsIgnoreCase(record.getSymbol())) {
                failed.add(new BackfillFailure(orderId, symbol, BackfillFailure.Reason.SYMBOL_MISMATCH,
                        "Fill of " + orderId + " is for " + record.getSymbol()));
                continue;
            }
            if (tradeLedger.append(record)) {
                inserted.add(orderId);
                affectedSymbols.add(record.getSymbol());
                if (ingestedUpTo == null || record.getIngestedAt().isAfter(ingestedUpTo)) {
                    ingestedUpTo = record.getIngestedAt();
                }
            } else {
                alreadyPresent.add(orderId);
            }
        }

        boolean recompute = !inserted.isEmpty();
        if (recompute) {
            applicationEventPublisher.publishEvent(new AllocationRecomputeRequestedEvent(
                    namespace, affectedSymbols, TRIGGER, ingestedUpTo));
        }
        BackfillStatus status = failed.isEmpty()
                ? BackfillStatus.COMPLETE
                : (inserted.isEmpty() && alreadyPresent.isEmpty() ? BackfillStatus.FAILED : BackfillStatus.PARTIAL_FAILURE);
        if (failed.isEmpty()) {
            log.info("Backfill for {}: {} inserted, {} already present", namespace, inserted.size(), alreadyPresent.size());
        } else {
            log.warn("Backfill for {}: {} inserted, {} already present, {} failed {}", namespace, inserted.size(),
                    alreadyPresent.size(), failed.size(), failed.stream().map(BackfillFailure::orderId).toList());
        }
        return new BackfillResult(namespace, status, inserted, alreadyPresent, failed, affectedSymbols, recompute);
    }
}
