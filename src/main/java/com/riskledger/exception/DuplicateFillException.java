package com.riskledger.exception;

import java.util.Map;

/** A fill id that was already applied to the ledger was delivered again. */
public class DuplicateFillException extends LedgerConsistencyException {

    public DuplicateFillException(String sessionId, String fillId) {
        super("Fill " + fillId + " already applied to session " + sessionId,
                Map.of("sessionId", sessionId, "fillId", fillId));
    }
}
