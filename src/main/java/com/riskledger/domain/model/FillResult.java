package com.riskledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Outcome of applying one fill to a ledger. {@code realizedPnl} is zero for BUY fills. */
@Value
@Builder
public class FillResult {

    String sessionId;
    String fillId;
    String symbol;
    BigDecimal cashAfter;
    BigDecimal portfolioValue;
    BigDecimal realizedPnl;
    LedgerTransaction transaction;
}
