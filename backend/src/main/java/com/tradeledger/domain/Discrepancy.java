package com.tradeledger.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of a reconciliation report (embedded). Deltas are external minus local and are null when the
 * field matched or does not apply.
 */
@NoArgsConstructor
@Getter
@Setter
public class Discrepancy {

    private DiscrepancyKind kind;
    private String symbol;
    private List<String> orderIds = new ArrayList<>();
    private TradeSide side;
    private Instant exchangeTimestamp;
    /** Names of mismatched fields for AMOUNT_MISMATCH (quantity, price, fee, side). */
    private List<String> mismatchedFields = new ArrayList<>();
    private BigDecimal localQuantity;
    private BigDecimal externalQuantity;
    private BigDecimal quantityDelta;
    private BigDecimal localPrice;
    private BigDecimal externalPrice;
    private BigDecimal priceDelta;
    private BigDecimal localFee;
    private BigDecimal externalFee;
    private BigDecimal feeDelta;

    public String primaryOrderId() {
        return orderIds.isEmpty() ? null : orderIds.get(0);
    }
}
