package com.riskledger.api.dto.response;

import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.DailyStats;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskStatusResponse {

    private String sessionId;
    private TradingMode mode;
    private String modeReason;
    private DailyStats dailyStats;
    private BigDecimal portfolioValue;
    private BigDecimal peakValue;
    private BigDecimal drawdown;
    private BigDecimal drawdownDollars;
    private BigDecimal exposure;
    private BigDecimal cash;

    private long persistenceFailures;
    private Instant lastPersistenceFailureAt;
    private String lastPersistenceFailure;
    private long buyingPowerFallbacks;
    private String buyingPowerCircuit;
    private int pendingSignals;
}
