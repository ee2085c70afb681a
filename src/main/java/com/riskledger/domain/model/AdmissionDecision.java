package com.riskledger.domain.model;

import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.enums.TradingMode;
import com.riskledger.risk.RiskDecision;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Terminal outcome of admitting one signal. */
@Value
@Builder
public class AdmissionDecision {

    String sessionId;
    TradeSignal signal;
    SignalState state;
    RiskDecision decision;
    TradingMode mode;
    Map<String, Double> ruleScores;
    BigDecimal portfolioValue;
    long processingTimeMs;
    Instant evaluatedAt;

    public boolean isApproved() {
        return state == SignalState.APPROVED;
    }
}
