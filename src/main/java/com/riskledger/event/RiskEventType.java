package com.riskledger.event;

/** Classifies the condition behind a {@link RiskEvent}. */
public enum RiskEventType {

    /** A session's derived trading mode changed. */
    MODE_CHANGED,

    /** A fill contradicted the ledger and was not applied. */
    LEDGER_INCONSISTENCY,

    /** A signal or fill message could not be validated. */
    INVALID_MESSAGE
}
