package com.tradeledger.allocation.version;

import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.UnmatchedSellResidue;
import com.tradeledger.domain.VersionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory store for unit tests. Returns copies so callers cannot mutate stored state, which keeps
 * the compare-and-set semantics of the Mongo store.
 */
public class InMemoryAllocationVersionStore implements AllocationVersionStore {

    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, AllocationVersion> versions = new HashMap<>();
    private final Map<String, Long> current = new HashMap<>();
    private final Map<String, Lease> leases = new HashMap<>();
    private final List<FifoAllocation> allocations = new ArrayList<>();
    private final List<UnmatchedSellResidue> residues = new ArrayList<>();
    private final List<OpenLot> openLots = new ArrayList<>();

    @Override
    public synchronized long reserveVersionNumber(String namespace) {
        return counters.merge(namespace, 1L, Long::sum);
    }

    @Override
    public synchronized AllocationVersion insertVersion(AllocationVersion version) {
        String key = key(version.getNamespace(), version.getVersionNumber());
        if (versions.containsKey(key)) {
            throw new VersionConflictException("Version " + version.getVersionNumber() + " already exists");
        }
        version.setId(key);
        versions.put(key, copy(version));
        return version;
    }

    @Override
    public synchronized boolean updateVersion(AllocationVersion version, VersionStatus expectedStatus) {
        String key = key(version.getNamespace(), version.getVersionNumber());
        AllocationVersion stored = versions.get(key);
        if (stored == null || stored.getStatus() != expectedStatus) {
            return false;
        }
        versions.put(key, copy(version));
        return true;
    }

    @Override
    public synchronized void writeRows(List<FifoAllocation> newAllocations, List<UnmatchedSellResidue> newResidues,
                                       List<OpenLot> newOpenLots) {
        newAllocations.forEach(a -> allocations.add(copy(a)));
        newResidues.forEach(r -> residues.add(copy(r)));
        newOpenLots.forEach(o -> openLots.add(copy(o)));
    }

    @Override
    public synchronized Optional<AllocationVersion> findVersion(String namespace, long versionNumber) {
        return Optional.ofNullable(versions.get(key(namespace, versionNumber))).map(InMemoryAllocationVersionStore::copy);
    }

    @Override
    public synchronized List<AllocationVersion> findVersions(String namespace, Instant from, Instant to) {
        return versions.values().stream()
                .filter(v -> v.getNamespace().equals(namespace))
                .filter(v -> from == null || !v.getCreatedAt().isBefore(from))
                .filter(v -> to == null || !v.getCreatedAt().isAfter(to))
                .sorted(Comparator.comparingLong(AllocationVersion::getVersionNumber))
                .map(InMemoryAllocationVersionStore::copy)
                .toList();
    }

    @Override
    public synchronized List<AllocationVersion> findByStatus(String namespace, VersionStatus status) {
        return versions.values().stream()
                .filter(v -> v.getNamespace().equals(namespace) && v.getStatus() == status)
                .sorted(Comparator.comparingLong(AllocationVersion::getVersionNumber))
                .map(InMemoryAllocationVersionStore::copy)
                .toList();
    }

    @Override
    public synchronized List<FifoAllocation> findAllocations(String namespace, long versionNumber, Collection<String> symbols) {
        return allocations.stream()
                .filter(a -> a.getNamespace().equals(namespace) && a.getVersionNumber() == versionNumber)
                .filter(inScope(symbols, FifoAllocation::getSymbol))
                .sorted(Comparator.comparingInt(FifoAllocation::getSequence))
                .map(InMemoryAllocationVersionStore::copy)
                .toList();
    }

    @Override
    public synchronized List<UnmatchedSellResidue> findResidues(String namespace, long versionNumber, Collection<String> symbols) {
        return residues.stream()
                .filter(r -> r.getNamespace().equals(namespace) && r.getVersionNumber() == versionNumber)
                .filter(inScope(symbols, UnmatchedSellResidue::getSymbol))
                .sorted(Comparator.comparingInt(UnmatchedSellResidue::getSequence))
                .map(InMemoryAllocationVersionStore::copy)
                .toList();
    }

    @Override
    public synchronized List<OpenLot> findOpenLots(String namespace, long versionNumber, Collection<String> symbols) {
        return openLots.stream()
                .filter(o -> o.getNamespace().equals(namespace) && o.getVersionNumber() == versionNumber)
                .filter(inScope(symbols, OpenLot::getSymbol))
                .map(InMemoryAllocationVersionStore::copy)
                .toList();
    }

    @Override
    public synchronized Optional<Long> findCurrentVersionNumber(String namespace) {
        return Optional.ofNullable(current.get(namespace));
    }

    @Override
    public synchronized boolean compareAndSetCurrent(String namespace, Long expected, long next) {
        Long actual = current.get(namespace);
        if (actual == null ? expected != null : !actual.equals(expected)) {
            return false;
        }
        current.put(namespace, next);
        return true;
    }

    @Override
    public synchronized boolean tryAcquireLease(String namespace, String holder, Instant now, Duration ttl) {
        Lease lease = leases.get(namespace);
        if (lease != null && !lease.holder.equals(holder) && lease.expiresAt.isAfter(now)) {
            return false;
        }
        leases.put(namespace, new Lease(holder, now.plus(ttl)));
        return true;
    }

    @Override
    public synchronized void releaseLease(String namespace, String holder) {
        Lease lease = leases.get(namespace);
        if (lease != null && lease.holder.equals(holder)) {
            leases.remove(namespace);
        }
    }

    /** Test hook: leaves a lease behind as a crashed run would. */
    public synchronized void putLease(String namespace, String holder, Instant expiresAt) {
        leases.put(namespace, new Lease(holder, expiresAt));
    }

    public synchronized boolean isLeaseHeld(String namespace) {
        return leases.containsKey(namespace);
    }

    private static <T> Predicate<T> inScope(Collection<String> symbols, java.util.function.Function<T, String> symbol) {
        return row -> symbols == null || symbols.isEmpty() || symbols.contains(symbol.apply(row));
    }

    private static String key(String namespace, long versionNumber) {
        return namespace + "#" + versionNumber;
    }

    private record Lease(String holder, Instant expiresAt) {
    }

    private static AllocationVersion copy(AllocationVersion v) {
        AllocationVersion c = new AllocationVersion();
        c.setId(v.getId());
        c.setNamespace(v.getNamespace());
        c.setVersionNumber(v.getVersionNumber());
        c.setStatus(v.getStatus());
        c.setMode(v.getMode());
        c.setCreatedAt(v.getCreatedAt());
        c.setLedgerCutoff(v.getLedgerCutoff());
        c.setComputedSymbols(new ArrayList<>(v.getComputedSymbols()));
        c.setCarriedForwardSymbols(new ArrayList<>(v.getCarriedForwardSymbols()));
        c.setBasedOnVersion(v.getBasedOnVersion());
        c.setSupersedes(v.getSupersedes());
        c.setSupersededBy(v.getSupersededBy());
        c.setPromotedAt(v.getPromotedAt());
        c.setCompletedAt(v.getCompletedAt());
        c.setTriggeredBy(v.getTriggeredBy());
        c.setBuysProcessed(v.getBuysProcessed());
        c.setSellsProcessed(v.getSellsProcessed());
        c.setAllocationCount(v.getAllocationCount());
        c.setResidueCount(v.getResidueCount());
        c.setOpenLotCount(v.getOpenLotCount());
        c.setTotalRealizedPnl(v.getTotalRealizedPnl());
        c.setDurationMs(v.getDurationMs());
        c.setHasUnmatchedResidue(v.isHasUnmatchedResidue());
        c.setValidationErrors(new ArrayList<>(v.getValidationErrors()));
        c.setValidationWarnings(new ArrayList<>(v.getValidationWarnings()));
        return c;
    }

    private static FifoAllocation copy(FifoAllocation a) {
        FifoAllocation c = new FifoAllocation();
        c.setId(a.getId());
        c.setNamespace(a.getNamespace());
        c.setVersionNumber(a.getVersionNumber());
        c.setSequence(a.getSequence());
        c.setSymbol(a.getSymbol());
        c.setSellOrderId(a.getSellOrderId());
        c.setBuyOrderId(a.getBuyOrderId());
        c.setQuantity(a.getQuantity());
        c.setBuyPrice(a.getBuyPrice());
        c.setSellPrice(a.getSellPrice());
        c.setBuyFeeShare(a.getBuyFeeShare());
        c.setSellFeeShare(a.getSellFeeShare());
        c.setCostBasis(a.getCostBasis());
        c.setProceeds(a.getProceeds());
        c.setNetProceeds(a.getNetProceeds());
        c.setRealizedPnl(a.getRealizedPnl());
        c.setBuyTime(a.getBuyTime());
        c.setSellTime(a.getSellTime());
        return c;
    }

    private static UnmatchedSellResidue copy(UnmatchedSellResidue r) {
        UnmatchedSellResidue c = new UnmatchedSellResidue();
        c.setId(r.getId());
        c.setNamespace(r.getNamespace());
        c.setVersionNumber(r.getVersionNumber());
        c.setSequence(r.getSequence());
        c.setSymbol(r.getSymbol());
        c.setSellOrderId(r.getSellOrderId());
        c.setQuantity(r.getQuantity());
        c.setSellPrice(r.getSellPrice());
        c.setSellFeeShare(r.getSellFeeShare());
        c.setProceeds(r.getProceeds());
        c.setNetProceeds(r.getNetProceeds());
        c.setSellTime(r.getSellTime());
        c.setNote(r.getNote());
        return c;
    }

    private static OpenLot copy(OpenLot o) {
        OpenLot c = new OpenLot();
        c.setId(o.getId());
        c.setNamespace(o.getNamespace());
        c.setVersionNumber(o.getVersionNumber());
        c.setSymbol(o.getSymbol());
        c.setBuyOrderId(o.getBuyOrderId());
        c.setOriginalQuantity(o.getOriginalQuantity());
        c.setRemainingQuantity(o.getRemainingQuantity());
        c.setBuyPrice(o.getBuyPrice());
        c.setBuyTime(o.getBuyTime());
        return c;
    }
}
