package com.tradeledger.allocation.run;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.allocation.engine.AllocationComputation;
import com.tradeledger.allocation.engine.FifoAllocationEngine;
import com.tradeledger.allocation.event.AllocationRunCompletedEvent;
import com.tradeledger.allocation.validation.ValidationResult;
import com.tradeledger.allocation.validation.ValidationService;
import com.tradeledger.allocation.version.AllocationVersionStore;
import com.tradeledger.allocation.version.LeaseHandle;
import com.tradeledger.allocation.version.VersionConflictException;
import com.tradeledger.allocation.version.VersionManager;
import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.domain.AllocationRunMode;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.ReviewIssueType;
import com.tradeledger.domain.ReviewSeverity;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.UnmatchedSellResidue;
import com.tradeledger.ledger.TradeLedger;
import com.tradeledger.review.ManualReviewQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs one allocation computation for a namespace under its lease: snapshot the ledger at a cutoff, reserve a
 * version, match, write rows, validate, and promote only a VALID version. The lease is renewed after computing
 * and before the terminal transition, and released once the version is VALID (and promoted) or INVALID.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AllocationRunService {

    private final VersionManager versionManager;
    private final AllocationVersionStore store;
    private final TradeLedger tradeLedger;
    private final FifoAllocationEngine engine;
    private final ValidationService validationService;
    private final ManualReviewQueue manualReviewQueue;
    private final AllocationProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * @throws com.tradeledger.allocation.version.ComputationInProgressException when the lease stays held past the wait
     * @throws com.tradeledger.allocation.version.VersionConflictException        when numbering or promotion collides
     */
    public AllocationRunResult run(AllocationRunRequest request) {
        String namespace = request.namespace();
        Duration wait = request.leaseWait() != null ? request.leaseWait() : properties.getLeaseWaitTimeout();
        LeaseHandle lease = versionManager.acquireLease(namespace, wait);
        try {
            versionManager.abandonStaleComputations(namespace);
            return computeUnderLease(request, lease);
        } finally {
            versionManager.releaseLease(lease);
        }
    }

    private AllocationRunResult computeUnderLease(AllocationRunRequest request, LeaseHandle lease) {
        long started = System.nanoTime();
        String namespace = request.namespace();
        Instant cutoff = clock.instant().minus(properties.getCutoffLag());
        Optional<AllocationVersion> current = versionManager.getCurrent(namespace);

        Set<String> computed = request.allSymbols() ? tradeLedger.distinctSymbols(cutoff) : request.symbols();
        List<String> carried = request.allSymbols() ? List.of() : carriedForwardSymbols(current, computed);
        AllocationVersion version = versionManager.reserve(
                namespace,
                request.allSymbols() ? AllocationRunMode.FULL : AllocationRunMode.SCOPED,
                new ArrayList<>(new TreeSet<>(computed)),
                carried,
                cutoff,
                current.map(AllocationVersion::getVersionNumber).orElse(null),
                request.triggeredBy());

        AllocationComputation computation;
        try {
            List<TradeRecord> snapshot = computed.isEmpty() ? List.of() : tradeLedger.scan(computed, cutoff);
            computation = engine.allocate(namespace, version.getVersionNumber(), snapshot);
            writeRows(version, computation, current.orElse(null), carried);
        } catch (RuntimeException e) {
            log.error("Allocation version {} of {} failed: {}", version.getVersionNumber(), namespace, e.getMessage(), e);
            version.setDurationMs(elapsedMs(started));
            versionManager.markInvalid(version, List.of("COMPUTATION_FAILED: " + e.getMessage()));
            publishCompleted(version, false);
            throw e;
        }

        renewOrGiveUp(lease, version);
        ValidationResult validation = validationService.validate(version);
        version.setDurationMs(elapsedMs(started));
        renewOrGiveUp(lease, version);
        if (!validation.valid()) {
            log.warn("Allocation version {} of {} is INVALID: {}", version.getVersionNumber(), namespace, validation.errorReasons());
            version.setValidationWarnings(validation.warningReasons());
            versionManager.markInvalid(version, validation.errorReasons());
            publishCompleted(version, false);
            return AllocationRunResult.of(version, false, LedgerErrorCode.VALIDATION_FAILURE);
        }

        versionManager.markValid(version, validation.warningReasons());
        versionManager.promote(version);
        flagResidues(version, computation.residues());
        publishCompleted(version, true);
        log.info("Allocation version {} of {} is current: {} allocations, {} residues, realized P&L {}",
                version.getVersionNumber(), namespace, version.getAllocationCount(), version.getResidueCount(),
                version.getTotalRealizedPnl().toPlainString());
        return AllocationRunResult.of(version, true,
                version.isHasUnmatchedResidue() ? LedgerErrorCode.DATA_INTEGRITY_ANOMALY : null);
    }

    /**
     * A run whose lease was taken over must not reach a terminal status itself: the new holder abandons the
     * version, or already has.
     */
    private void renewOrGiveUp(LeaseHandle lease, AllocationVersion version) {
        try {
            versionManager.renewLease(lease);
        } catch (VersionConflictException e) {
            log.error("Allocation version {} of {} lost its lease, leaving it to the next run", version.getVersionNumber(),
                    version.getNamespace());
            throw e;
        }
    }

    private static List<String> carriedForwardSymbols(Optional<AllocationVersion> current, Set<String> computed) {
        if (current.isEmpty()) {
            return List.of();
        }
        TreeSet<String> carried = new TreeSet<>(current.get().getComputedSymbols());
        carried.addAll(current.get().getCarriedForwardSymbols());
        carried.removeAll(computed);
        return new ArrayList<>(carried);
    }

    /**
     * Writes the computed rows plus copies of the based-on version's rows for carried-forward symbols.
     * Copies keep their relative order and are sequenced after the computed rows.
     */
    private void writeRows(AllocationVersion version, AllocationComputation computation,
                           AllocationVersion basedOn, List<String> carried) {
        List<FifoAllocation> allocations = new ArrayList<>(computation.allocations());
        List<UnmatchedSellResidue> residues = new ArrayList<>(computation.residues());
        List<OpenLot> openLots = new ArrayList<>(computation.openLots());

        if (basedOn != null && !carried.isEmpty()) {
            String namespace = version.getNamespace();
            long from = basedOn.getVersionNumber();
            int sequence = allocations.size() + residues.size();
            for (FifoAllocation a : store.findAllocations(namespace, from, carried)) {
                a.setId(null);
                a.setVersionNumber(version.getVersionNumber());
                a.setSequence(sequence++);
                allocations.add(a);
            }
            for (UnmatchedSellResidue r : store.findResidues(namespace, from, carried)) {
                r.setId(null);
                r.setVersionNumber(version.getVersionNumber());
                r.setSequence(sequence++);
                residues.add(r);
            }
            for (OpenLot lot : store.findOpenLots(namespace, from, carried)) {
                lot.setId(null);
                lot.setVersionNumber(version.getVersionNumber());
                openLots.add(lot);
            }
        }
        store.writeRows(allocations, residues, openLots);

        BigDecimal totalPnl = BigDecimal.ZERO;
        for (FifoAllocation a : allocations) {
            totalPnl = totalPnl.add(a.getRealizedPnl());
        }
        version.setBuysProcessed(computation.buysProcessed());
        version.setSellsProcessed(computation.sellsProcessed());
        version.setAllocationCount(allocations.size());
        version.setResidueCount(residues.size());
        version.setOpenLotCount(openLots.size());
        version.setTotalRealizedPnl(totalPnl);
        version.setHasUnmatchedResidue(!residues.isEmpty());
    }

    private void flagResidues(AllocationVersion version, List<UnmatchedSellResidue> residues) {
        String detectedBy = "allocation:" + version.getNamespace() + ":v" + version.getVersionNumber();
        for (UnmatchedSellResidue residue : residues) {
            manualReviewQueue.flag(residue.getSellOrderId(), residue.getSymbol(), ReviewIssueType.UNMATCHED_SELL,
                    ReviewSeverity.MEDIUM, residue.getNote(), detectedBy);
        }
    }

    private void publishCompleted(AllocationVersion version, boolean promoted) {
        applicationEventPublisher.publishEvent(new AllocationRunCompletedEvent(
                this, version.getNamespace(), version.getVersionNumber(), version.getStatus(), promoted));
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
