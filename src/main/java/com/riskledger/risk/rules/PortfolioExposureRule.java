package com.riskledger.risk.rules;

import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskLimits.PortfolioLimits;
import com.riskledger.risk.RiskMath;
import com.riskledger.risk.RiskRule;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Portfolio-level concentration for BUY signals: total exposure, single-symbol weight and
 * the cash reserve left after the trade, each as a fraction of total portfolio value.
 * SELLs only reduce exposure and always pass.
 */
@Component
public class PortfolioExposureRule implements RiskRule {

    public static final String NAME = "PORTFOLIO_EXPOSURE";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskDecision evaluate(RiskContext context) {
        TradeSignal signal = context.getSignal();
        PortfolioState portfolio = context.getPortfolio();
        RiskLimits limits = context.getLimits();
        PortfolioLimits portfolioLimits = limits.getPortfolio();

        BigDecimal totalValue = totalValue(portfolio, limits);
        BigDecimal currentExposure = portfolio.getExposure();

        if (!signal.isBuy()) {
            return RiskDecision.pass(
                    NAME,
                    ratioOf(currentExposure, totalValue, portfolioLimits.getMaxPortfolioExposure()),
                    Map.of("currentExposure", currentExposure, "totalValue", totalValue, "checkSkipped", true));
        }

        BigDecimal tradeValue = signal.notional();
        BigDecimal projectedExposure = currentExposure.add(tradeValue);
        BigDecimal exposurePct = RiskMath.fraction(projectedExposure, totalValue);

        BigDecimal maxExposure = portfolioLimits.getMaxPortfolioExposure();
        if (maxExposure != null && exposurePct.compareTo(maxExposure) > 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentExposure", currentExposure);
            details.put("projectedExposure", projectedExposure);
            details.put("totalValue", totalValue);
            details.put("exposurePct", exposurePct);
            details.put("limit", maxExposure);
            return RiskDecision.fail(
                    NAME,
                    "Portfolio exposure " + RiskMath.percent(exposurePct, 1) + "% would exceed max ("
                            + RiskMath.percent(maxExposure, 1) + "%)",
                    RiskMath.ratio(exposurePct, maxExposure),
                    details);
        }

        int projectedQuantity = portfolio.heldQuantity(signal.getSymbol()) + signal.getQuantity();
        BigDecimal projectedPositionValue = signal.getPrice().multiply(BigDecimal.valueOf(projectedQuantity));
        BigDecimal positionPct = RiskMath.fraction(projectedPositionValue, totalValue);

        BigDecimal maxSingle = portfolioLimits.getMaxSinglePositionPct();
        if (maxSingle != null && positionPct.compareTo(maxSingle) > 0) {
            return RiskDecision.fail(
                    NAME,
                    "Position in " + signal.getSymbol() + " would be " + RiskMath.percent(positionPct, 1)
                            + "% of portfolio, exceeds max (" + RiskMath.percent(maxSingle, 1) + "%)",
                    RiskMath.ratio(positionPct, maxSingle),
                    Map.of("symbol", signal.getSymbol(), "projectedPositionValue", projectedPositionValue,
                            "positionPct", positionPct, "limit", maxSingle));
        }

        BigDecimal reservePct = portfolioLimits.getReserveCashPct();
        BigDecimal cashAfterTrade = portfolio.getCash().subtract(tradeValue);
        if (reservePct != null) {
            BigDecimal requiredCash = totalValue.multiply(reservePct);
            if (cashAfterTrade.compareTo(requiredCash) < 0) {
                return RiskDecision.fail(
                        NAME,
                        "Trade would leave only $" + RiskMath.money(cashAfterTrade) + " cash, need $"
                                + RiskMath.money(requiredCash) + " reserve (" + RiskMath.percent(reservePct, 1) + "%)",
                        RiskMath.ratio(requiredCash, cashAfterTrade.signum() > 0 ? cashAfterTrade : BigDecimal.ONE),
                        Map.of("cashAfterTrade", cashAfterTrade, "requiredCash", requiredCash, "limit", reservePct));
            }
        }

        double score = Math.max(
                maxExposure != null ? RiskMath.ratio(exposurePct, maxExposure) : 0.0,
                maxSingle != null ? RiskMath.ratio(positionPct, maxSingle) : 0.0);
        return RiskDecision.pass(
                NAME,
                score,
                Map.of("exposurePct", exposurePct, "positionPct", positionPct, "cashAfterTrade", cashAfterTrade));
    }

    private static BigDecimal totalValue(PortfolioState portfolio, RiskLimits limits) {
        BigDecimal value = portfolio.getPortfolioValue();
        if (value != null && value.signum() > 0) {
            return value;
        }
        BigDecimal configured = limits.getCapital().getCurrentEquity();
        return configured != null ? configured : limits.getCapital().getInitialCapital();
    }

    private static double ratioOf(BigDecimal exposure, BigDecimal totalValue, BigDecimal limit) {
        return limit != null ? RiskMath.ratio(RiskMath.fraction(exposure, totalValue), limit) : 0.0;
    }
}
