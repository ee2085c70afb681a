package com.riskledger.exception;

import java.util.Map;

/**
 * A fill contradicts the ledger's state. The mutation is aborted before any field
 * changes, so the ledger is exactly as it was before the call.
 */
public class LedgerConsistencyException extends BaseException {

    public LedgerConsistencyException(String message, Map<String, Object> details) {
        super(ErrorCode.LEDGER_INCONSISTENCY, message, details);
    }
}
