package com.tradeledger.allocation.engine;

import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.UnmatchedSellResidue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Output of one engine run: matches and residues in deterministic sequence order, open lots, and counters.
 */
public record AllocationComputation(
        Set<String> symbols,
        List<FifoAllocation> allocations,
        List<UnmatchedSellResidue> residues,
        List<OpenLot> openLots,
        int buysProcessed,
        int sellsProcessed,
        BigDecimal totalRealizedPnl
) {

    public boolean hasResidue() {
        return !residues.isEmpty();
    }
}
