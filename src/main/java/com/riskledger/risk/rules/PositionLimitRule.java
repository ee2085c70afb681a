package com.riskledger.risk.rules;

import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.Position;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits.PositionLimits;
import com.riskledger.risk.RiskMath;
import com.riskledger.risk.RiskRule;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Per-trade and per-position size limits. A BUY is checked against the position it would
 * create; a SELL may never exceed the quantity currently held.
 */
@Component
public class PositionLimitRule implements RiskRule {

    public static final String NAME = "POSITION_LIMITS";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskDecision evaluate(RiskContext context) {
        PositionLimits limits = context.getLimits().getPosition();
        TradeSignal signal = context.getSignal();
        PortfolioState portfolio = context.getPortfolio();

        int quantity = signal.getQuantity();
        BigDecimal tradeValue = signal.notional();

        Integer maxShares = limits.getMaxSharesPerTrade();
        if (maxShares != null && quantity > maxShares) {
            return RiskDecision.fail(
                    NAME,
                    "Trade size " + quantity + " exceeds max shares per trade (" + maxShares + ")",
                    RiskMath.ratio(quantity, maxShares),
                    Map.of("quantity", quantity, "limit", maxShares));
        }

        BigDecimal maxDollars = limits.getMaxDollarValuePerTrade();
        if (maxDollars != null && tradeValue.compareTo(maxDollars) > 0) {
            return RiskDecision.fail(
                    NAME,
                    "Trade value $" + RiskMath.money(tradeValue) + " exceeds max per trade ($"
                            + RiskMath.money(maxDollars) + ")",
                    RiskMath.ratio(tradeValue, maxDollars),
                    Map.of("tradeValue", tradeValue, "limit", maxDollars));
        }

        Position current = portfolio.position(signal.getSymbol());
        int held = current != null ? current.getQuantity() : 0;

        if (signal.isBuy()) {
            int projectedQuantity = held + quantity;
            Integer maxPositionShares = limits.getMaxPositionShares();
            if (maxPositionShares != null && projectedQuantity > maxPositionShares) {
                return RiskDecision.fail(
                        NAME,
                        "Projected position " + projectedQuantity + " exceeds max position shares ("
                                + maxPositionShares + ")",
                        RiskMath.ratio(projectedQuantity, maxPositionShares),
                        Map.of("currentQuantity", held, "projectedQuantity", projectedQuantity,
                                "limit", maxPositionShares));
            }

            BigDecimal currentValue = current != null ? current.getMarketValue() : BigDecimal.ZERO;
            BigDecimal projectedExposure = currentValue.add(tradeValue);
            BigDecimal maxPositionDollars = limits.getMaxPositionDollars();
            if (maxPositionDollars != null && projectedExposure.compareTo(maxPositionDollars) > 0) {
                return RiskDecision.fail(
                        NAME,
                        "Projected exposure $" + RiskMath.money(projectedExposure)
                                + " exceeds max position dollars ($" + RiskMath.money(maxPositionDollars) + ")",
                        RiskMath.ratio(projectedExposure, maxPositionDollars),
                        Map.of("currentExposure", currentValue, "projectedExposure", projectedExposure,
                                "limit", maxPositionDollars));
            }
        } else if (quantity > held) {
            return RiskDecision.fail(
                    NAME,
                    "Cannot sell " + quantity + " shares, only own " + held,
                    RiskMath.ratio(quantity, Math.max(held, 1)),
                    Map.of("requestedQuantity", quantity, "currentQuantity", held));
        }

        double score = Math.max(
                maxShares != null ? RiskMath.ratio(quantity, maxShares) : 0.0,
                maxDollars != null ? RiskMath.ratio(tradeValue, maxDollars) : 0.0);
        return RiskDecision.pass(NAME, score, Map.of("quantity", quantity, "tradeValue", tradeValue));
    }
}
