package com.riskledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Session performance summary computed from snapshot history and SELL transactions. */
@Value
@Builder
public class PerformanceMetrics {

    String sessionId;
    BigDecimal initialCapital;
    BigDecimal currentValue;
    BigDecimal totalReturn;
    double totalReturnPct;
    double sharpeRatio;
    double maxDrawdown;
    double winRate;
    double profitFactor;
    int totalTrades;
    int winningTrades;
    int losingTrades;
    BigDecimal totalCommissions;
}
