package com.tradeledger.reconciliation;

import com.tradeledger.domain.ReconciliationTier;
import com.tradeledger.domain.TimeWindow;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Parameters of a reconciliation run.
 *
 * @param tiers   tiers to execute, run in ascending strictness; empty means all tiers
 * @param symbols symbol scope; empty means every symbol in the ledger
 */
public record ReconciliationRequest(
        String namespace,
        List<ReconciliationTier> tiers,
        Set<String> symbols,
        TimeWindow window,
        boolean autoBackfill
) {

    public ReconciliationRequest {
        tiers = tiers == null || tiers.isEmpty()
                ? List.of(ReconciliationTier.values())
                : tiers.stream().distinct().sorted().toList();
        symbols = symbols == null ? Set.of() : Collections.unmodifiableSortedSet(symbols.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new)));
    }
}
