package com.tradeledger.reconciliation;

import com.tradeledger.backfill.BackfillCoordinator;
import com.tradeledger.backfill.BackfillResult;
import com.tradeledger.common.InvalidRequestException;
import com.tradeledger.domain.Discrepancy;
import com.tradeledger.domain.DiscrepancyKind;
import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.ReconciliationReport;
import com.tradeledger.domain.ReconciliationReportRepository;
import com.tradeledger.domain.ReconciliationTier;
import com.tradeledger.domain.ReviewIssueType;
import com.tradeledger.domain.ReviewSeverity;
import com.tradeledger.domain.TimeWindow;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.exchange.ExchangeFillSource;
import com.tradeledger.ledger.TradeLedger;
import com.tradeledger.reconciliation.config.ReconciliationProperties;
import com.tradeledger.review.ManualReviewQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Executes a reconciliation run: fixes the ledger snapshot cutoff, fetches the external fills of every symbol in
 * scope, runs the requested tiers, persists one report per tier, queues anomalies for review and, with
 * auto-backfill, hands MissingTrade entries to the backfill coordinator.
 * <p>
 * All external fetches happen before anything is persisted: if the exchange is unavailable the run aborts with
 * SourceUnavailableException and leaves no report behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationRunService {

    private final ExchangeFillSource exchangeFillSource;
    private final TradeLedger tradeLedger;
    private final ReconciliationEngine engine;
    private final ReconciliationReportRepository reportRepository;
    private final MongoTemplate mongoTemplate;
    private final ManualReviewQueue manualReviewQueue;
    private final BackfillCoordinator backfillCoordinator;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public ReconciliationRunResult run(ReconciliationRequest request) {
        TimeWindow window = request.window();
        if (window == null) {
            throw new InvalidRequestException("A reconciliation run needs a time window");
        }
        if (window.length().compareTo(properties.getMaxWindow()) > 0) {
            throw new InvalidRequestException("Window of " + window.length().toDays() + " days exceeds the maximum of "
                    + properties.getMaxWindow().toDays());
        }
        Instant cutoff = clock.instant();
        Set<String> symbols = request.symbols().isEmpty() ? tradeLedger.distinctSymbols(cutoff) : request.symbols();

        Map<String, List<RawFill>> external = new TreeMap<>();
        for (String symbol : symbols) {
            external.put(symbol, exchangeFillSource.listFills(symbol, window));
        }
        Map<String, List<TradeRecord>> local = new TreeMap<>();
        for (String symbol : symbols) {
            local.put(symbol, tradeLedger.findInWindow(symbol, window, cutoff));
        }

        String runId = UUID.randomUUID().toString();
        Instant createdAt = clock.instant();
        List<ReconciliationReport> reports = new ArrayList<>();
        for (ReconciliationTier tier : request.tiers()) {
            ReconciliationReport report = engine.report(runId, request.namespace(), tier, window, cutoff, createdAt,
                    local, external, properties.getAmountTolerance());
            reports.add(reportRepository.insert(report));
            log.info("Reconciliation {} tier {} for {} over {} symbols: {} discrepancies (cutoff {})", runId, tier,
                    request.namespace(), report.getSymbols().size(), report.getDiscrepancies().size(), cutoff);
        }
        if (properties.isFlagAnomalies()) {
            flagAnomalies(runId, reports);
        }

        BackfillResult backfill = null;
        if (request.autoBackfill()) {
            backfill = reports.stream()
                    .filter(r -> r.getTier() == ReconciliationTier.PRESENCE)
                    .findFirst()
                    .map(backfillCoordinator::backfill)
                    .orElseGet(() -> {
                        log.info("Auto-backfill skipped for {}: presence tier not executed", runId);
                        return BackfillResult.nothingToDo(request.namespace());
                    });
        }
        return new ReconciliationRunResult(runId, reports, backfill);
    }

    /** Reports of a namespace created in [from, to], oldest first. A null bound is open. */
    public List<ReconciliationReport> findReports(String namespace, Instant from, Instant to) {
        Criteria criteria = where("namespace").is(namespace);
        if (from != null || to != null) {
            Criteria createdAt = criteria.and("createdAt");
            if (from != null) {
                createdAt.gte(from);
            }
            if (to != null) {
                createdAt.lte(to);
            }
        }
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("tier")));
        return mongoTemplate.find(query, ReconciliationReport.class);
    }

    public List<ReconciliationReport> findRun(String runId) {
        return reportRepository.findByRunIdOrderByTierAsc(runId);
    }

    private void flagAnomalies(String runId, List<ReconciliationReport> reports) {
        String detectedBy = "reconciliation:" + runId;
        for (ReconciliationReport report : reports) {
            for (Discrepancy d : report.getDiscrepancies()) {
                if (d.getKind() == DiscrepancyKind.EXTRA_TRADE) {
                    manualReviewQueue.flag(d.primaryOrderId(), d.getSymbol(), ReviewIssueType.EXTRA_TRADE, ReviewSeverity.HIGH,
                            "Ledger order unknown to the exchange in " + report.getWindowFrom() + ".." + report.getWindowTo(),
                            detectedBy);
                } else if (d.getKind() == DiscrepancyKind.AMOUNT_MISMATCH) {
                    manualReviewQueue.flag(d.primaryOrderId(), d.getSymbol(), ReviewIssueType.AMOUNT_MISMATCH, ReviewSeverity.MEDIUM,
                            "Ledger and exchange differ on " + String.join(", ", d.getMismatchedFields()), detectedBy);
                }
            }
        }
    }
}
