package com.riskledger.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** One row of a session's snapshot history. */
@Value
@Builder
public class PortfolioSnapshotRecord {

    String sessionId;
    BigDecimal cash;
    BigDecimal portfolioValue;
    BigDecimal totalRealizedPnl;
    BigDecimal totalUnrealizedPnl;
    BigDecimal drawdown;
    int numPositions;
    List<Position> positions;
    Instant snapshotTime;
}
