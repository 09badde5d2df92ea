package com.tradeledger.exchange;

import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.common.LedgerException;

/**
 * The exchange could not be reached, timed out, or kept failing after bounded retries.
 */
public class SourceUnavailableException extends LedgerException {

    public SourceUnavailableException(String message) {
        super(LedgerErrorCode.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(LedgerErrorCode.SOURCE_UNAVAILABLE, message, cause);
    }
}
