package com.riskledger.domain.enums;

/**
 * Where a buying-power figure came from. {@code AUTHORITATIVE} means the ledger itself
 * (local snapshot or remote ledger query); {@code FALLBACK} means a local estimate made
 * because the authoritative source was unreachable.
 */
public enum BuyingPowerSource {
    AUTHORITATIVE("authoritative"),
    FALLBACK("fallback");

    private final String label;

    BuyingPowerSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
