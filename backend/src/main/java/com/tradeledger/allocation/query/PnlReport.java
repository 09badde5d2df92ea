package com.tradeledger.allocation.query;

import com.tradeledger.domain.VersionStatus;

import java.math.BigDecimal;
import java.util.List;

public record PnlReport(
        String namespace,
        long versionNumber,
        VersionStatus status,
        boolean hasUnmatchedResidue,
        BigDecimal totalRealizedPnl,
        List<SymbolPnl> symbols
) {
}
