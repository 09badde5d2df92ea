package com.tradeledger.allocation.version;

/**
 * Proof of holding the allocation lease of a namespace; required to release it.
 */
public record LeaseHandle(String namespace, String holder) {
}
