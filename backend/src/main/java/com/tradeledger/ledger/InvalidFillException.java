package com.tradeledger.ledger;

/**
 * A raw fill cannot be turned into a trade record (missing id, non-positive quantity, unknown side, ...).
 */
public class InvalidFillException extends RuntimeException {

    public InvalidFillException(String message) {
        super(message);
    }
}
