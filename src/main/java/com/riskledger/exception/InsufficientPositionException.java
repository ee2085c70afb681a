package com.riskledger.exception;

import java.util.Map;

/** SELL fill for more shares than the session holds. */
public class InsufficientPositionException extends LedgerConsistencyException {

    public InsufficientPositionException(String sessionId, String symbol, String fillId, int requested, int held) {
        super(
                "Cannot sell " + requested + " " + symbol + ", only " + held + " held (session " + sessionId + ")",
                Map.of(
                        "sessionId", sessionId,
                        "symbol", symbol,
                        "fillId", fillId,
                        "requested", requested,
                        "held", held));
    }
}
