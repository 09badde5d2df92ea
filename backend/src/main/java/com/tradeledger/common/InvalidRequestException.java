package com.tradeledger.common;

/**
 * Caller supplied parameters that cannot be executed (empty window, unknown tier, ...).
 */
public class InvalidRequestException extends LedgerException {

    public InvalidRequestException(String message) {
        super(LedgerErrorCode.INVALID_REQUEST, message);
    }
}
