package com.tradeledger.allocation.version;

import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.common.LedgerException;

/**
 * The allocation lease of the namespace is held by another run.
 */
public class ComputationInProgressException extends LedgerException {

    public ComputationInProgressException(String namespace) {
        super(LedgerErrorCode.COMPUTATION_IN_PROGRESS, "An allocation computation is already in progress for namespace " + namespace);
    }
}
