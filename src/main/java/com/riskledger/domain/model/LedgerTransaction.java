package com.riskledger.domain.model;

import com.riskledger.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only record of one applied fill, with the cash and portfolio value on both sides
 * of the mutation. {@code realizedPnl} is null for BUY fills.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTransaction {

    private Long id;
    private String sessionId;
    private String fillId;
    private String symbol;
    private TradeAction action;
    private int quantity;
    private BigDecimal price;
    private BigDecimal amount;
    private BigDecimal commission;
    private BigDecimal realizedPnl;
    private BigDecimal cashBefore;
    private BigDecimal cashAfter;
    private BigDecimal portfolioValueBefore;
    private BigDecimal portfolioValueAfter;
    private Instant timestamp;
    private String notes;
}
