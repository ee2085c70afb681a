package com.riskledger.domain.enums;

/** Admission lifecycle of a signal: RECEIVED, then EVALUATING, then one of the terminal states. */
public enum SignalState {
    RECEIVED,
    EVALUATING,
    APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED;
    }
}
