package com.riskledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Latest ledger totals for a session; overwritten after every applied fill. */
@Entity
@Table(name = "portfolio_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioStateEntity {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(precision = 19, scale = 6)
    private BigDecimal cash;

    @Column(name = "initial_capital", precision = 19, scale = 6)
    private BigDecimal initialCapital;

    @Column(name = "total_realized_pnl", precision = 19, scale = 6)
    private BigDecimal totalRealizedPnl;

    @Column(name = "total_unrealized_pnl", precision = 19, scale = 6)
    private BigDecimal totalUnrealizedPnl;

    @Column(name = "total_commissions", precision = 19, scale = 6)
    private BigDecimal totalCommissions;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "peak_value", precision = 19, scale = 6)
    private BigDecimal peakValue;

    @Column(name = "portfolio_value", precision = 19, scale = 6)
    private BigDecimal portfolioValue;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
