package com.riskledger.entity;

import com.riskledger.domain.enums.SignalState;
import com.riskledger.domain.enums.TradeAction;
import com.riskledger.domain.enums.TradingMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Audit row for one admission decision. */
@Entity
@Table(
        name = "risk_events",
        indexes = {
            @Index(name = "idx_risk_events_time", columnList = "evaluated_at"),
            @Index(name = "idx_risk_events_decision", columnList = "decision, evaluated_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "signal_id", length = 64)
    private String signalId;

    @Column(name = "strategy_id", length = 64)
    private String strategyId;

    @Column(length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private TradeAction action;

    private int quantity;

    @Column(precision = 19, scale = 6)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private SignalState decision;

    @Column(name = "rule_name", length = 32)
    private String ruleName;

    @Column(length = 500)
    private String reason;

    private double score;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private TradingMode mode;

    @Column(name = "portfolio_value", precision = 19, scale = 6)
    private BigDecimal portfolioValue;

    @Column(name = "processing_time_ms")
    private long processingTimeMs;

    @Lob
    @Column(name = "details_json")
    private String detailsJson;

    @Column(name = "evaluated_at")
    private Instant evaluatedAt;
}
