package com.tradeledger.domain;

/**
 * Lifecycle of an allocation version. COMPUTING moves to VALID or INVALID; only VALID may become current,
 * and a current version becomes SUPERSEDED when a newer one is promoted.
 */
public enum VersionStatus {
    COMPUTING,
    VALID,
    INVALID,
    SUPERSEDED;

    public boolean isTerminal() {
        return this != COMPUTING;
    }
}
