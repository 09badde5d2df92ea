package com.tradeledger.allocation.version;

import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.common.LedgerException;

/**
 * Two computations collided on a version number or on the current-version pointer. Retry later.
 */
public class VersionConflictException extends LedgerException {

    public VersionConflictException(String message) {
        super(LedgerErrorCode.VERSION_CONFLICT, message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(LedgerErrorCode.VERSION_CONFLICT, message, cause);
    }
}
