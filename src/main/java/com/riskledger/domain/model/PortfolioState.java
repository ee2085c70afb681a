package com.riskledger.domain.model;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time read projection of a session ledger. Every derived figure is computed
 * under the ledger lock at the moment the projection is built, so the fields are
 * mutually consistent.
 *
 * <ul>
 *   <li>{@code portfolioValue} = cash + sum of quantity x mark price</li>
 *   <li>{@code exposure} = sum of |quantity x mark price|</li>
 *   <li>{@code buyingPower} = cash (no margin)</li>
 *   <li>{@code drawdown} = (peak - value) / peak, zero when peak is zero</li>
 * </ul>
 */
@Value
@Builder
public class PortfolioState {

    String sessionId;
    BigDecimal cash;
    BigDecimal initialCapital;
    Map<String, Position> positions;
    BigDecimal totalRealizedPnl;
    BigDecimal totalUnrealizedPnl;
    BigDecimal totalCommissions;
    int totalTrades;
    BigDecimal peakValue;
    BigDecimal portfolioValue;
    BigDecimal buyingPower;
    BigDecimal exposure;
    BigDecimal drawdown;
    BigDecimal totalPnl;
    int numPositions;

    public Position position(String symbol) {
        return positions.get(symbol);
    }

    public int heldQuantity(String symbol) {
        Position position = positions.get(symbol);
        return position != null ? position.getQuantity() : 0;
    }
}
