package com.tradeledger.api.dto;

import com.tradeledger.api.validation.ReconciliationTiers;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * POST /api/v1/reconciliations. Tiers: "1"/"presence", "2"/"value" or "all"; empty = all.
 * Empty symbols = every symbol in the ledger.
 */
public record ReconciliationRunRequestBody(
        String namespace,
        @ReconciliationTiers
        List<String> tiers,
        List<String> symbols,
        @NotNull(message = "INVALID_WINDOW")
        Instant from,
        @NotNull(message = "INVALID_WINDOW")
        Instant to,
        boolean autoBackfill
) {
}
