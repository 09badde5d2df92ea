package com.tradeledger.domain;

import java.time.Instant;
import java.util.Set;

/**
 * Application event: request a new allocation version for the given symbols (e.g. after backfill inserted rows).
 * Published by backfill; consumed by allocation.
 *
 * @param ingestedUpTo latest {@code ingestedAt} the requester wrote; the new version's cutoff must not precede it.
 *                     Null when the request does not follow a write.
 */
public record AllocationRecomputeRequestedEvent(String namespace, Set<String> symbols, String triggeredBy, Instant ingestedUpTo) {

    public AllocationRecomputeRequestedEvent {
        symbols = Set.copyOf(symbols);
    }
}
