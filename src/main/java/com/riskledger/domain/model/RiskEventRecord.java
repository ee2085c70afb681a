package com.riskledger.domain.model;

import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.enums.TradingMode;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of the admission audit log, as returned by the risk events queries. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEventRecord {

    private Long id;
    private String sessionId;
    private String signalId;
    private String strategyId;
    private String symbol;
    private TradeAction action;
    private int quantity;
    private BigDecimal price;
    private SignalState decision;
    private String ruleName;
    private String reason;
    private double score;
    private TradingMode mode;
    private BigDecimal portfolioValue;
    private long processingTimeMs;
    private Map<String, Object> details;
    private Instant evaluatedAt;
}
