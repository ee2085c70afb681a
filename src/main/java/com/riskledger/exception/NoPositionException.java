package com.riskledger.exception;

import java.util.Map;

/** SELL fill for a symbol the session does not hold. */
public class NoPositionException extends LedgerConsistencyException {

    public NoPositionException(String sessionId, String symbol, String fillId) {
        super(
                "No position in " + symbol + " to sell (session " + sessionId + ")",
                Map.of("sessionId", sessionId, "symbol", symbol, "fillId", fillId));
    }
}
