package com.riskledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "risk_daily_stats",
        uniqueConstraints =
                @UniqueConstraint(name = "uk_daily_stats_session_day", columnNames = {"session_id", "trading_day"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyStatsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 64, nullable = false)
    private String sessionId;

    @Column(name = "trading_day", nullable = false)
    private LocalDate tradingDay;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "approved_trades")
    private int approvedTrades;

    @Column(name = "rejected_trades")
    private int rejectedTrades;

    @Column(name = "realized_pnl", precision = 19, scale = 6)
    private BigDecimal realizedPnl;

    @Column(name = "consecutive_losses")
    private int consecutiveLosses;

    @Column(name = "consecutive_wins")
    private int consecutiveWins;

    @Column(name = "last_trade_time")
    private Instant lastTradeTime;

    @Lob
    @Column(name = "symbol_counts_json")
    private String symbolCountsJson;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
