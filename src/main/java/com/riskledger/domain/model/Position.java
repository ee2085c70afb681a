package com.riskledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Holding of one symbol inside a session ledger.
 *
 * <p>{@code avgPrice} is the quantity-weighted entry price; only a BUY changes it.
 * {@code lastPrice} stays null until the first BUY fill or market price update.
 * Instances handed out by the ledger are copies; mutating them has no effect on the ledger.
 */
@Data
@JsonIgnoreProperties(value = "marketValue", allowGetters = true)
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String symbol;
    private int quantity;
    private BigDecimal avgPrice;
    private BigDecimal lastPrice;

    @Builder.Default
    private BigDecimal unrealizedPnl = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Price used for valuation: last traded/quoted price, or entry price before any quote. */
    public BigDecimal markPrice() {
        return lastPrice != null ? lastPrice : avgPrice;
    }

    public BigDecimal getMarketValue() {
        return markPrice().multiply(BigDecimal.valueOf(quantity));
    }

    public Position copy() {
        return toBuilder().build();
    }
}
