package com.riskledger.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to rebuild a ledger exactly: restoring a snapshot and reading the
 * state yields the same {@link PortfolioState} as the ledger it was taken from.
 */
@Value
@Builder
public class LedgerSnapshot {

    String sessionId;
    BigDecimal initialCapital;
    BigDecimal cash;
    BigDecimal peakValue;
    BigDecimal totalRealizedPnl;
    BigDecimal totalUnrealizedPnl;
    BigDecimal totalCommissions;
    int totalTrades;
    List<Position> positions;
    Set<String> appliedFillIds;
}
