package com.tradeledger.api.dto;

import com.tradeledger.domain.AllocationRunMode;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.VersionStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Version metadata for audit and reporting; rows are served by separate endpoints.
 */
public record AllocationVersionResponse(
        String namespace,
        long versionNumber,
        VersionStatus status,
        AllocationRunMode mode,
        Instant createdAt,
        Instant completedAt,
        Instant promotedAt,
        Instant ledgerCutoff,
        List<String> computedSymbols,
        List<String> carriedForwardSymbols,
        Long basedOnVersion,
        Long supersedes,
        Long supersededBy,
        String triggeredBy,
        int buysProcessed,
        int sellsProcessed,
        int allocationCount,
        int residueCount,
        int openLotCount,
        BigDecimal totalRealizedPnl,
        boolean hasUnmatchedResidue,
        List<String> validationErrors,
        List<String> validationWarnings
) {

    public static AllocationVersionResponse from(AllocationVersion v) {
        return new AllocationVersionResponse(
                v.getNamespace(),
                v.getVersionNumber(),
                v.getStatus(),
                v.getMode(),
                v.getCreatedAt(),
                v.getCompletedAt(),
                v.getPromotedAt(),
                v.getLedgerCutoff(),
                v.getComputedSymbols(),
                v.getCarriedForwardSymbols(),
                v.getBasedOnVersion(),
                v.getSupersedes(),
                v.getSupersededBy(),
                v.getTriggeredBy(),
                v.getBuysProcessed(),
                v.getSellsProcessed(),
                v.getAllocationCount(),
                v.getResidueCount(),
                v.getOpenLotCount(),
                v.getTotalRealizedPnl(),
                v.isHasUnmatchedResidue(),
                v.getValidationErrors(),
                v.getValidationWarnings()
        );
    }
}
