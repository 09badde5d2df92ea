package com.tradeledger.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fill as reported by the exchange, before normalization. When an order filled in several pieces this is the
 * aggregate: summed quantity and fee, quantity-weighted price, timestamp of the last piece.
 */
public record RawFill(
        String orderId,
        String tradeId,
        String symbol,
        String side,
        BigDecimal quantity,
        BigDecimal price,
        BigDecimal fee,
        Instant tradeTime
) {
}
