package com.tradeledger.allocation.query;

import com.tradeledger.allocation.version.AllocationVersionStore;
import com.tradeledger.allocation.version.VersionManager;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.UnmatchedSellResidue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read side for downstream reporting: versions by number or current, their rows, and P&amp;L per symbol.
 * Reads by explicit version number always return that version's rows, superseded or not.
 */
@Service
@RequiredArgsConstructor
public class AllocationQueryService {

    private final VersionManager versionManager;
    private final AllocationVersionStore store;

    /** Explicit version, or the current version when {@code versionNumber} is null. */
    public AllocationVersion resolveVersion(String namespace, Long versionNumber) {
        return versionNumber != null
                ? versionManager.getByVersion(namespace, versionNumber)
                : versionManager.requireCurrent(namespace);
    }

    public List<FifoAllocation> allocations(String namespace, long versionNumber, Collection<String> symbols) {
        versionManager.getByVersion(namespace, versionNumber);
        return store.findAllocations(namespace, versionNumber, symbols);
    }

    public List<UnmatchedSellResidue> residues(String namespace, long versionNumber) {
        versionManager.getByVersion(namespace, versionNumber);
        return store.findResidues(namespace, versionNumber, List.of());
    }

    public List<OpenLot> openLots(String namespace, long versionNumber) {
        versionManager.getByVersion(namespace, versionNumber);
        return store.findOpenLots(namespace, versionNumber, List.of());
    }

    public PnlReport pnl(String namespace, Long versionNumber) {
        AllocationVersion version = resolveVersion(namespace, versionNumber);
        long number = version.getVersionNumber();
        Map<String, Accumulator> bySymbol = new TreeMap<>();
        for (FifoAllocation a : store.findAllocations(namespace, number, List.of())) {
            Accumulator acc = bySymbol.computeIfAbsent(a.getSymbol(), k -> new Accumulator());
            acc.count++;
            acc.matched = acc.matched.add(a.getQuantity());
            acc.costBasis = acc.costBasis.add(a.getCostBasis());
            acc.netProceeds = acc.netProceeds.add(a.getNetProceeds());
            acc.realized = acc.realized.add(a.getRealizedPnl());
        }
        for (UnmatchedSellResidue r : store.findResidues(namespace, number, List.of())) {
            Accumulator acc = bySymbol.computeIfAbsent(r.getSymbol(), k -> new Accumulator());
            acc.unmatched = acc.unmatched.add(r.getQuantity());
        }
        for (OpenLot lot : store.findOpenLots(namespace, number, List.of())) {
            Accumulator acc = bySymbol.computeIfAbsent(lot.getSymbol(), k -> new Accumulator());
            acc.open = acc.open.add(lot.getRemainingQuantity());
        }

        List<SymbolPnl> symbols = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, Accumulator> e : bySymbol.entrySet()) {
            Accumulator acc = e.getValue();
            symbols.add(new SymbolPnl(e.getKey(), acc.count, acc.matched, acc.costBasis, acc.netProceeds,
                    acc.realized, acc.unmatched, acc.open));
            total = total.add(acc.realized);
        }
        return new PnlReport(namespace, number, version.getStatus(), version.isHasUnmatchedResidue(), total, symbols);
    }

    private static final class Accumulator {
        private int count;
        private BigDecimal matched = BigDecimal.ZERO;
        private BigDecimal costBasis = BigDecimal.ZERO;
        private BigDecimal netProceeds = BigDecimal.ZERO;
        private BigDecimal realized = BigDecimal.ZERO;
        private BigDecimal unmatched = BigDecimal.ZERO;
        private BigDecimal open = BigDecimal.ZERO;
    }
}
