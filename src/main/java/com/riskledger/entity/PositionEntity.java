package com.riskledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Open position of a session, one row per (session, symbol). Rows for positions that
 * went flat are deleted on the next state write.
 */
@Entity
@Table(
        name = "positions",
        uniqueConstraints = @UniqueConstraint(name = "uk_positions_session_symbol", columnNames = {"session_id", "symbol"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 64, nullable = false)
    private String sessionId;

    @Column(length = 32, nullable = false)
    private String symbol;

    private int quantity;

    @Column(name = "avg_price", precision = 19, scale = 6)
    private BigDecimal avgPrice;

    @Column(name = "last_price", precision = 19, scale = 6)
    private BigDecimal lastPrice;

    @Column(name = "unrealized_pnl", precision = 19, scale = 6)
    private BigDecimal unrealizedPnl;

    @Column(name = "realized_pnl", precision = 19, scale = 6)
    private BigDecimal realizedPnl;

    @Column(name = "market_value", precision = 19, scale = 6)
    private BigDecimal marketValue;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
