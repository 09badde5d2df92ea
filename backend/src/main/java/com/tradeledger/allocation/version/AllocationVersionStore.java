package com.tradeledger.allocation.version;

import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.FifoAllocation;
import com.tradeledger.domain.OpenLot;
import com.tradeledger.domain.UnmatchedSellResidue;
import com.tradeledger.domain.VersionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for allocation versions, their rows, the current-version pointer and the computation
 * lease. Every operation that guards a concurrency rule is atomic at the storage layer.
 */
public interface AllocationVersionStore {

    /** Atomically reserves the next version number of the namespace (1 for the first). */
    long reserveVersionNumber(String namespace);

    /**
     * Inserts a new version.
     *
     * @throws VersionConflictException when the (namespace, versionNumber) pair already exists
     */
    AllocationVersion insertVersion(AllocationVersion version);

    /**
     * Replaces the stored version if its status still equals {@code expectedStatus}.
     *
     * @return false when the status changed in the meantime
     */
    boolean updateVersion(AllocationVersion version, VersionStatus expectedStatus);

    void writeRows(List<FifoAllocation> allocations, List<UnmatchedSellResidue> residues, List<OpenLot> openLots);

    Optional<AllocationVersion> findVersion(String namespace, long versionNumber);

    /** Versions created in [from, to], ascending by number. A null bound is open. */
    List<AllocationVersion> findVersions(String namespace, Instant from, Instant to);

    List<AllocationVersion> findByStatus(String namespace, VersionStatus status);

    /** Rows of a version in sequence order; an empty symbol collection means all symbols. */
    List<FifoAllocation> findAllocations(String namespace, long versionNumber, Collection<String> symbols);

    List<UnmatchedSellResidue> findResidues(String namespace, long versionNumber, Collection<String> symbols);

    List<OpenLot> findOpenLots(String namespace, long versionNumber, Collection<String> symbols);

    Optional<Long> findCurrentVersionNumber(String namespace);

    /**
     * Swaps the current pointer from {@code expected} (null when the namespace has none) to {@code next}.
     *
     * @return false when the pointer no longer holds {@code expected}
     */
    boolean compareAndSetCurrent(String namespace, Long expected, long next);

    /** Takes the lease when it is free or expired. */
    boolean tryAcquireLease(String namespace, String holder, Instant now, Duration ttl);

    void releaseLease(String namespace, String holder);
}
