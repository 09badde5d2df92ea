package com.tradeledger.common;

/**
 * Error taxonomy shared by the allocation, reconciliation and backfill flows.
 */
public enum LedgerErrorCode {
    /** External dependency unreachable or timed out. Retryable. */
    SOURCE_UNAVAILABLE,
    /** Two computations claimed the same version number. */
    VERSION_CONFLICT,
    /** Allocation lease for the namespace is held by another run. */
    COMPUTATION_IN_PROGRESS,
    /** Some backfill fetches failed; the succeeded subset is committed. */
    PARTIAL_BACKFILL_FAILURE,
    /** Structural invariant of an allocation version violated. */
    VALIDATION_FAILURE,
    /** Unmatched sell residue, extra trade or amount mismatch awaiting human review. */
    DATA_INTEGRITY_ANOMALY,
    NOT_FOUND,
    INVALID_REQUEST
}
