package com.tradeledger.allocation.run;

import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parameters of an allocation run: a namespace and either an explicit symbol scope or every symbol.
 *
 * @param leaseWait how long to wait for a held lease; null uses the configured default
 */
public record AllocationRunRequest(String namespace, Set<String> symbols, boolean allSymbols, String triggeredBy, Duration leaseWait) {

    public AllocationRunRequest {
        symbols = symbols == null ? Set.of() : normalizeSymbols(symbols);
        if (!allSymbols && symbols.isEmpty()) {
            throw new IllegalArgumentException("An allocation run needs explicit symbols or the 'all' scope");
        }
    }

    // Ledger rows carry upper-cased symbols; scopes must match them.
    private static Set<String> normalizeSymbols(Set<String> symbols) {
        TreeSet<String> normalized = new TreeSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                normalized.add(symbol.strip().toUpperCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSortedSet(normalized);
    }

    public static AllocationRunRequest all(String namespace, String triggeredBy) {
        return new AllocationRunRequest(namespace, Set.of(), true, triggeredBy, null);
    }

    public static AllocationRunRequest scoped(String namespace, Set<String> symbols, String triggeredBy) {
        return new AllocationRunRequest(namespace, symbols, false, triggeredBy, null);
    }

    public AllocationRunRequest withLeaseWait(Duration wait) {
        return new AllocationRunRequest(namespace, symbols, allSymbols, triggeredBy, wait);
    }
}
