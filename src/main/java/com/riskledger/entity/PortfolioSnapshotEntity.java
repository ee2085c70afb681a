package com.riskledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

/** Periodic point-in-time copy of a session's portfolio, used for equity curves and Sharpe. */
@Entity
@Table(
        name = "portfolio_snapshots",
        indexes = @Index(name = "idx_snapshots_session_time", columnList = "session_id, snapshot_time"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PortfolioSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 64, nullable = false)
    private String sessionId;

    @Column(precision = 19, scale = 6)
    private BigDecimal cash;

    @Column(name = "portfolio_value", precision = 19, scale = 6)
    private BigDecimal portfolioValue;

    @Column(name = "total_realized_pnl", precision = 19, scale = 6)
    private BigDecimal totalRealizedPnl;

    @Column(name = "total_unrealized_pnl", precision = 19, scale = 6)
    private BigDecimal totalUnrealizedPnl;

    @Column(precision = 19, scale = 6)
    private BigDecimal drawdown;

    @Column(name = "num_positions")
    private int numPositions;

    /** JSON array of the open positions at snapshot time. */
    @Lob
    @Column(name = "positions_json")
    private String positionsJson;

    @Column(name = "snapshot_time")
    private Instant snapshotTime;
}
