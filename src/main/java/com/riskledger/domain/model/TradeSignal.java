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
 * A proposed trade from a strategy. Read-only once issued: the pipeline never mutates a
 * signal, it only derives copies with {@link #toBuilder()} (to stamp a generated id).
 *
 * <p>{@code backtestId} doubles as the session id; absent means the default paper session.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradeSignal {

    private String signalId;

    @JsonAlias("strategy_id")
    private String strategyId;

    private String symbol;
    private TradeAction action;
    private Integer quantity;
    private BigDecimal price;

    @JsonAlias("backtest_id")
    private String backtestId;

    private Instant timestamp;

    public BigDecimal notional() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isBuy() {
        return action == TradeAction.BUY;
    }
}
