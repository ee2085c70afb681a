package com.riskledger.domain.enums;

/**
 * Operating mode of a session, derived from drawdown and daily loss on every query.
 *
 * <p>Ordered by severity so callers can compare with {@code compareTo}.
 */
public enum TradingMode {

    /** No limits breached. */
    NORMAL,

    /** Soft warning signs (losing streak, elevated drawdown); per-trade size is reduced. */
    DEFENSIVE,

    /** A hard loss or drawdown limit is breached; new exposure is halted. */
    LOCKDOWN
}
