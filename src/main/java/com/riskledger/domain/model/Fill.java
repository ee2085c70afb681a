package com.riskledger.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.riskledger.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Execution report for a previously approved signal. {@code fillId} is the idempotency key:
 * each distinct fill id mutates its session's ledger exactly once.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Fill {

    @JsonAlias("fill_id")
    private String fillId;

    @JsonAlias("signal_id")
    private String signalId;

    @JsonAlias("strategy_id")
    private String strategyId;

    private String symbol;
    private TradeAction action;
    private Integer quantity;
    private BigDecimal price;
    private BigDecimal commission;

    @JsonAlias("backtest_id")
    private String backtestId;

    private Instant timestamp;

    public BigDecimal commissionOrZero() {
        return commission != null ? commission : BigDecimal.ZERO;
    }
}
