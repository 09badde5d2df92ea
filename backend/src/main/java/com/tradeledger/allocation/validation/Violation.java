package com.tradeledger.allocation.validation;

/**
 * One structured validation finding.
 */
public record Violation(ViolationCode code, String symbol, String orderId, String message) {

    /** Stored on the version as a reason string. */
    public String toReason() {
        StringBuilder sb = new StringBuilder(code.name());
        if (symbol != null) {
            sb.append(' ').append(symbol);
        }
        if (orderId != null) {
            sb.append(' ').append(orderId);
        }
        return sb.append(": ").append(message).toString();
    }
}
