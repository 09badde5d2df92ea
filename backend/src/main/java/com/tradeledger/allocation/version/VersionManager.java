package com.tradeledger.allocation.version;

import com.tradeledger.allocation.config.AllocationProperties;
import com.tradeledger.domain.AllocationRunMode;
import com.tradeledger.domain.AllocationVersion;
import com.tradeledger.domain.VersionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns version numbering, status transitions, the current-version pointer and the per-namespace computation
 * lease. Promotion is a compare-and-set on the pointer and only accepts VALID versions; the replaced version
 * becomes SUPERSEDED and keeps all of its rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VersionManager {

    private final AllocationVersionStore store;
    private final AllocationProperties properties;
    private final Clock clock;

    /**
     * Acquires the namespace lease, polling until {@code waitTimeout} elapses.
     *
     * @throws ComputationInProgressException when the lease is still held after the wait
     */
    public LeaseHandle acquireLease(String namespace, Duration waitTimeout) {
        String holder = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + Math.max(0L, waitTimeout.toNanos());
        while (true) {
            if (store.tryAcquireLease(namespace, holder, clock.instant(), properties.getLeaseTtl())) {
                log.debug("Acquired allocation lease for {} ({})", namespace, holder);
                return new LeaseHandle(namespace, holder);
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                throw new ComputationInProgressException(namespace);
            }
            sleep(Math.min(properties.getLeasePollInterval().toMillis(), Math.max(1L, remainingNanos / 1_000_000L)), namespace);
        }
    }

    /**
     * Extends a held lease by another TTL.
     *
     * @throws VersionConflictException when the lease expired and another run has taken it
     */
    public void renewLease(LeaseHandle lease) {
        if (!store.tryAcquireLease(lease.namespace(), lease.holder(), clock.instant(), properties.getLeaseTtl())) {
            throw new VersionConflictException("Allocation lease of " + lease.namespace() + " was taken over by another run");
        }
        log.debug("Renewed allocation lease for {} ({})", lease.namespace(), lease.holder());
    }

    public void releaseLease(LeaseHandle lease) {
        store.releaseLease(lease.namespace(), lease.holder());
        log.debug("Released allocation lease for {}", lease.namespace());
    }

    /**
     * Marks COMPUTING versions left behind by a crashed run as INVALID. Call only while holding the lease:
     * no live computation of the namespace can exist then.
     */
    public int abandonStaleComputations(String namespace) {
        List<AllocationVersion> stale = store.findByStatus(namespace, VersionStatus.COMPUTING);
        for (AllocationVersion version : stale) {
            log.warn("Version {} of {} never finished computing, marking INVALID", version.getVersionNumber(), namespace);
            markInvalid(version, List.of("ABANDONED: computation did not reach a terminal status"));
        }
        return stale.size();
    }

    /**
     * Reserves the next version number and records the version in COMPUTING status.
     */
    public AllocationVersion reserve(
            String namespace,
            AllocationRunMode mode,
            List<String> computedSymbols,
            List<String> carriedForwardSymbols,
            Instant ledgerCutoff,
            Long basedOnVersion,
            String triggeredBy
    ) {
        long number = store.reserveVersionNumber(namespace);
        AllocationVersion version = new AllocationVersion();
        version.setNamespace(namespace);
        version.setVersionNumber(number);
        version.setStatus(VersionStatus.COMPUTING);
        version.setMode(mode);
        version.setCreatedAt(clock.instant());
        version.setLedgerCutoff(ledgerCutoff);
        version.setComputedSymbols(new ArrayList<>(computedSymbols));
        version.setCarriedForwardSymbols(new ArrayList<>(carriedForwardSymbols));
        version.setBasedOnVersion(basedOnVersion);
        version.setTriggeredBy(triggeredBy);
        AllocationVersion saved = store.insertVersion(version);
        log.info("Reserved allocation version {} of {} ({} symbols, cutoff {})", number, namespace, computedSymbols.size(), ledgerCutoff);
        return saved;
    }

    public void markValid(AllocationVersion version, List<String> warnings) {
        version.setValidationWarnings(new ArrayList<>(warnings));
        transition(version, VersionStatus.COMPUTING, VersionStatus.VALID);
    }

    public void markInvalid(AllocationVersion version, List<String> reasons) {
        version.setValidationErrors(new ArrayList<>(reasons));
        transition(version, VersionStatus.COMPUTING, VersionStatus.INVALID);
    }

    /**
     * Makes a VALID version the current one of its namespace and supersedes the previous current version.
     *
     * @throws VersionConflictException when a newer version is already current or the pointer moved concurrently
     */
    public AllocationVersion promote(AllocationVersion version) {
        if (version.getStatus() != VersionStatus.VALID) {
            throw new IllegalStateException("Only VALID versions can be promoted, version "
                    + version.getVersionNumber() + " is " + version.getStatus());
        }
        String namespace = version.getNamespace();
        long number = version.getVersionNumber();
        Long previous = store.findCurrentVersionNumber(namespace).orElse(null);
        if (previous != null && previous >= number) {
            throw new VersionConflictException("Namespace " + namespace + " already has current version "
                    + previous + ", cannot promote " + number);
        }
        if (!store.compareAndSetCurrent(namespace, previous, number)) {
            throw new VersionConflictException("Current version of " + namespace + " changed while promoting " + number);
        }
        Instant now = clock.instant();
        version.setPromotedAt(now);
        version.setSupersedes(previous);
        if (!store.updateVersion(version, VersionStatus.VALID)) {
            throw new VersionConflictException("Version " + number + " of " + namespace + " changed while promoting");
        }
        if (previous != null) {
            store.findVersion(namespace, previous).ifPresent(prior -> {
                prior.setStatus(VersionStatus.SUPERSEDED);
                prior.setSupersededBy(number);
                if (!store.updateVersion(prior, VersionStatus.VALID)) {
                    log.warn("Version {} of {} was not VALID when superseded by {}", previous, namespace, number);
                }
            });
        }
        log.info("Promoted allocation version {} of {} (supersedes {})", number, namespace, previous);
        return version;
    }

    public Optional<AllocationVersion> getCurrent(String namespace) {
        return store.findCurrentVersionNumber(namespace).flatMap(n -> store.findVersion(namespace, n));
    }

    public AllocationVersion requireCurrent(String namespace) {
        return getCurrent(namespace).orElseThrow(() -> new VersionNotFoundException(namespace));
    }

    public AllocationVersion getByVersion(String namespace, long versionNumber) {
        return store.findVersion(namespace, versionNumber)
                .orElseThrow(() -> new VersionNotFoundException(namespace, versionNumber));
    }

    public List<AllocationVersion> findVersions(String namespace, Instant from, Instant to) {
        return store.findVersions(namespace, from, to);
    }

    private void transition(AllocationVersion version, VersionStatus from, VersionStatus to) {
        if (version.getStatus() != from) {
            throw new IllegalStateException("Version " + version.getVersionNumber() + " is " + version.getStatus()
                    + ", expected " + from);
        }
        version.setStatus(to);
        version.setCompletedAt(clock.instant());
        if (!store.updateVersion(version, from)) {
            version.setStatus(from);
            throw new VersionConflictException("Version " + version.getVersionNumber() + " of " + version.getNamespace()
                    + " left " + from + " concurrently");
        }
    }

    private static void sleep(long millis, String namespace) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationInProgressException(namespace);
        }
    }
}
