package com.riskledger.domain.enums;

/** Direction of a signal or fill. Cash-and-long only: SELL always reduces an existing holding. */
public enum TradeAction {
    BUY,
    SELL
}
