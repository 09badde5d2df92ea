package com.tradeledger.allocation.query;

import java.math.BigDecimal;

/**
 * Realized P&amp;L of one symbol in one version. Residue quantity is reported separately and is not part of
 * the realized figures.
 */
public record SymbolPnl(
        String symbol,
        int allocationCount,
        BigDecimal matchedQuantity,
        BigDecimal costBasis,
        BigDecimal netProceeds,
        BigDecimal realizedPnl,
        BigDecimal unmatchedQuantity,
        BigDecimal openQuantity
) {
}
