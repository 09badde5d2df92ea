package com.tradeledger.allocation.version;

import com.tradeledger.common.LedgerErrorCode;
import com.tradeledger.common.LedgerException;

public class VersionNotFoundException extends LedgerException {

    public VersionNotFoundException(String namespace, long versionNumber) {
        super(LedgerErrorCode.NOT_FOUND, "No allocation version " + versionNumber + " in namespace " + namespace);
    }

    public VersionNotFoundException(String namespace) {
        super(LedgerErrorCode.NOT_FOUND, "Namespace " + namespace + " has no current allocation version");
    }
}
