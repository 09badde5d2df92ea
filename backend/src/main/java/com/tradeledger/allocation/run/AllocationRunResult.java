package com.tradeledger.allocation.run;

import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.VersionStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured outcome of an allocation run. {@code errorCode} is VALIDATION_FAILURE for an invalid version,
 * DATA_INTEGRITY_ANOMALY for a promoted version with unmatched residue, null otherwise.
 */
public record AllocationRunResult(
        String namespace,
        long versionNumber,
        VersionStatus status,
        boolean promoted,
        Long supersedes,
        List<String> computedSymbols,
        List<String> carriedForwardSymbols,
        int buysProcessed,
        int sellsProcessed,
        int allocationCount,
        int residueCount,
        int openLotCount,
        BigDecimal totalRealizedPnl,
        long durationMs,
        List<String> validationErrors,
        List<String> validationWarnings,
        LedgerErrorCode errorCode
) {

    public boolean success() {
        return promoted;
    }

    static AllocationRunResult of(AllocationVersion v, boolean promoted, LedgerErrorCode errorCode) {
        return new AllocationRunResult(
                v.getNamespace(),
                v.getVersionNumber(),
                v.getStatus(),
                promoted,
                v.getSupersedes(),
                List.copyOf(v.getComputedSymbols()),
                List.copyOf(v.getCarriedForwardSymbols()),
                v.getBuysProcessed(),
                v.getSellsProcessed(),
                v.getAllocationCount(),
                v.getResidueCount(),
                v.getOpenLotCount(),
                v.getTotalRealizedPnl(),
                v.getDurationMs(),
                List.copyOf(v.getValidationErrors()),
                List.copyOf(v.getValidationWarnings()),
                errorCode);
    }
}
