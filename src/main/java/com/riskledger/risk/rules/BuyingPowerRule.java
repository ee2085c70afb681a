package com.riskledger.risk.rules;

import com.riskledger.domain.model.BuyingPowerQuote;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.BuyingPowerSettings;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskMath;
import com.riskledger.risk.RiskRule;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * BUY signals must be covered by available buying power. SELLs are skipped.
 *
 * <p>Every decision reports in {@code details.source} whether the figure was authoritative
 * or a fallback estimate. Fallback quotes are held to an extra no-leverage check, and can
 * be barred from approving at all via {@code allow-fallback-approval}.
 */
@Component
public class BuyingPowerRule implements RiskRule {

    public static final String NAME = "BUYING_POWER";

    private static final BigDecimal MAX_FALLBACK_LEVERAGE = BigDecimal.ONE;

    private final BuyingPowerSettings settings;

    public BuyingPowerRule(BuyingPowerSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskDecision evaluate(RiskContext context) {
        TradeSignal signal = context.getSignal();
        if (!signal.isBuy()) {
            return RiskDecision.pass(NAME, 0.0, Map.of("action", signal.getAction().name(), "checkSkipped", true));
        }

        BuyingPowerQuote quote = context.getBuyingPower();
        BigDecimal tradeValue = signal.notional();
        BigDecimal buyingPower = quote.getBuyingPower();
        String fallbackSuffix = quote.isFallback() ? " (fallback)" : "";

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tradeValue", tradeValue);
        details.put("buyingPower", buyingPower);
        details.put("source", quote.getSource().label());
        if (quote.getError() != null) {
            details.put("error", quote.getError());
        }

        if (tradeValue.compareTo(buyingPower) > 0) {
            details.put("shortfall", tradeValue.subtract(buyingPower));
            return RiskDecision.fail(
                    NAME,
                    "Insufficient buying power: need $" + RiskMath.money(tradeValue) + ", have $"
                            + RiskMath.money(buyingPower) + fallbackSuffix,
                    RiskMath.ratio(tradeValue, positiveOrOne(buyingPower)),
                    details);
        }

        if (quote.isFallback()) {
            BigDecimal leverage = RiskMath.fraction(quote.getExposure().add(tradeValue), quote.getPortfolioValue());
            details.put("leverage", leverage);
            if (leverage.compareTo(MAX_FALLBACK_LEVERAGE) > 0) {
                return RiskDecision.fail(
                        NAME,
                        "Trade would create leverage (" + leverage.setScale(2, RoundingMode.HALF_UP)
                                + "x), not allowed (fallback)",
                        leverage.doubleValue(),
                        details);
            }
            if (!settings.isAllowFallbackApproval()) {
                return RiskDecision.fail(
                        NAME,
                        "Buying power could not be confirmed by the ledger (fallback approvals disabled)",
                        RiskMath.ratio(tradeValue, positiveOrOne(buyingPower)),
                        details);
            }
        }

        return RiskDecision.pass(NAME, RiskMath.ratio(tradeValue, positiveOrOne(buyingPower)), details);
    }

    private static BigDecimal positiveOrOne(BigDecimal value) {
        return value.signum() > 0 ? value : BigDecimal.ONE;
    }
}
