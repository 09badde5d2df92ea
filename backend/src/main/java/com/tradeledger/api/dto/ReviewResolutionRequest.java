package com.tradeledger.api.dto;

import com.tradeledger.domain.ReviewStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ReviewResolutionRequest(
        @NotNull(message = "INVALID_REQUEST")
        ReviewStatus status,
        @NotBlank(message = "INVALID_REQUEST")
        String resolution,
        String resolvedBy
) {
}
