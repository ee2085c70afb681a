package com.riskledger.entity;

import com.riskledger.domain.enums.TradeAction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Append-only fill journal. Never updated after insert. */
@Entity
@Table(
        name = "transactions",
        indexes = {
            @Index(name = "idx_transactions_session_time", columnList = "session_id, timestamp"),
            @Index(name = "idx_transactions_fill", columnList = "fill_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", length = 64, nullable = false)
    private String sessionId;

    @Column(name = "fill_id", length = 64)
    private String fillId;

    @Column(length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 4)
    private TradeAction action;

    private int quantity;

    @Column(precision = 19, scale = 6)
    private BigDecimal price;

    @Column(precision = 19, scale = 6)
    private BigDecimal amount;

    @Column(precision = 19, scale = 6)
    private BigDecimal commission;

    @Column(name = "realized_pnl", precision = 19, scale = 6)
    private BigDecimal realizedPnl;

    @Column(name = "cash_before", precision = 19, scale = 6)
    private BigDecimal cashBefore;

    @Column(name = "cash_after", precision = 19, scale = 6)
    private BigDecimal cashAfter;

    @Column(name = "portfolio_value_before", precision = 19, scale = 6)
    private BigDecimal portfolioValueBefore;

    @Column(name = "portfolio_value_after", precision = 19, scale = 6)
    private BigDecimal portfolioValueAfter;

    private Instant timestamp;

    @Column(length = 255)
    private String notes;
}
