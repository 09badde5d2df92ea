package com.tradeledger.api.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * POST /api/v1/allocations/runs. Either {@code all=true} or a non-empty {@code symbols} list.
 * Missing namespace = configured default; missing leaseWaitMs = configured wait (fail fast by default).
 */
public record AllocationRunRequestBody(
        String namespace,
        List<String> symbols,
        Boolean all,
        @PositiveOrZero(message = "INVALID_REQUEST")
        Long leaseWaitMs
) {
}
