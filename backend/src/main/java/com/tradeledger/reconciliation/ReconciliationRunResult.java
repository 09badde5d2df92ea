package com.tradeledger.reconciliation;

import com.tradeledger.backfill.BackfillResult;
import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.domain.DiscrepancyKind;
import com.tradeledger.domain.ReconciliationReport;

import java.util.List;

/**
 * Reports of the executed tiers (ascending) and, with auto-backfill, the backfill outcome (null otherwise).
 */
public record ReconciliationRunResult(String runId, List<ReconciliationReport> reports, BackfillResult backfill) {

    public ReconciliationRunResult {
        reports = List.copyOf(reports);
    }

    public long count(DiscrepancyKind kind) {
        return reports.stream().mapToLong(r -> r.discrepanciesOf(kind).size()).sum();
    }

    /**
     * PARTIAL_BACKFILL_FAILURE if backfill left trades behind, DATA_INTEGRITY_ANOMALY if any discrepancy was found,
     * null when local and external agree.
     */
    public LedgerErrorCode errorCode() {
        if (backfill != null && backfill.errorCode() != null) {
            return backfill.errorCode();
        }
        boolean anyDiscrepancy = reports.stream().anyMatch(r -> !r.getDiscrepancies().isEmpty());
        return anyDiscrepancy ? LedgerErrorCode.DATA_INTEGRITY_ANOMALY : null;
    }
}
