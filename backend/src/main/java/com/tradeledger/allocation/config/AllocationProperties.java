package com.tradeledger.allocation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Allocation runs: default namespace and the per-namespace computation lease. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tradeledger.allocation")
@NoArgsConstructor
@Getter
@Setter
public class AllocationProperties {

    private String defaultNamespace = "default";

    /**
     * Lease lifetime; a lease older than this is considered abandoned and may be taken over. A run renews its
     * lease after computing and again before promoting, so one phase must finish within this time.
     */
    private Duration leaseTtl = Duration.ofMinutes(30);

    /**
     * How far the ledger cutoff of a run trails the clock. Ingestion stamps {@code ingestedAt} before the insert
     * lands, so rows stamped within this margin of the run start may not be visible yet and are left to the next run.
     */
    private Duration cutoffLag = Duration.ofSeconds(5);

    /** How long an API-triggered run waits for a held lease. Zero fails fast with COMPUTATION_IN_PROGRESS. */
    private Duration leaseWaitTimeout = Duration.ZERO;

    /** How long a recompute requested by backfill waits for the lease. */
    private Duration recomputeLeaseWaitTimeout = Duration.ofMinutes(10);

    private Duration leasePollInterval = Duration.ofMillis(500);
}
