package com.riskledger.risk.rules;

import com.riskledger.domain.enums.TradingMode;
import com.riskledger.risk.LossMeasures;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskLimits.LossLimits;
import com.riskledger.risk.RiskMath;
import com.riskledger.risk.RiskRule;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Daily loss, losing streak and drawdown limits. Each failure names in
 * {@code details.mode} the trading mode the breach puts the account in.
 */
@Component
public class LossLimitRule implements RiskRule {

    public static final String NAME = "LOSS_LIMITS";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RiskDecision evaluate(RiskContext context) {
        RiskLimits limits = context.getLimits();
        LossLimits loss = limits.getLoss();
        LossMeasures measures = LossMeasures.of(context.getPortfolio(), context.getDailyStats(), limits);

        BigDecimal dailyPnl = measures.getDailyRealizedPnl();
        BigDecimal dailyLoss = dailyPnl.negate().max(BigDecimal.ZERO);

        BigDecimal maxDailyLoss = loss.getMaxDailyLoss();
        if (maxDailyLoss != null && dailyPnl.compareTo(maxDailyLoss.negate()) < 0) {
            return RiskDecision.fail(
                    NAME,
                    "Daily loss $" + RiskMath.money(dailyLoss) + " exceeds limit ($" + RiskMath.money(maxDailyLoss)
                            + ")",
                    RiskMath.ratio(dailyLoss, maxDailyLoss),
                    details(TradingMode.LOCKDOWN, "realizedPnl", dailyPnl, "limit", maxDailyLoss));
        }

        BigDecimal maxDailyLossPct = loss.getMaxDailyLossPct();
        BigDecimal dailyPct = measures.getDailyPnlPct();
        if (maxDailyLossPct != null && dailyPct.compareTo(maxDailyLossPct.negate()) < 0) {
            return RiskDecision.fail(
                    NAME,
                    "Daily loss " + RiskMath.percent(dailyPct.abs(), 2) + "% exceeds limit ("
                            + RiskMath.percent(maxDailyLossPct, 2) + "%)",
                    RiskMath.ratio(dailyPct.abs(), maxDailyLossPct),
                    details(TradingMode.LOCKDOWN, "realizedPnl", dailyPnl, "lossPct", dailyPct, "limit", maxDailyLossPct));
        }

        Integer maxStreak = loss.getMaxConsecutiveLosses();
        int streak = measures.getConsecutiveLosses();
        if (maxStreak != null && streak >= maxStreak) {
            return RiskDecision.fail(
                    NAME,
                    streak + " consecutive losses, exceeds limit (" + maxStreak + ")",
                    RiskMath.ratio(streak, maxStreak),
                    details(TradingMode.DEFENSIVE, "consecutiveLosses", streak, "limit", maxStreak));
        }

        BigDecimal drawdownPct = measures.getDrawdownPct();
        BigDecimal drawdownDollars = measures.getDrawdownDollars();

        BigDecimal maxDrawdown = loss.getMaxDrawdown();
        if (maxDrawdown != null && drawdownPct.compareTo(maxDrawdown) > 0) {
            return RiskDecision.fail(
                    NAME,
                    "Drawdown " + RiskMath.percent(drawdownPct, 2) + "% exceeds max (" + RiskMath.percent(maxDrawdown, 2)
                            + "%)",
                    RiskMath.ratio(drawdownPct, maxDrawdown),
                    drawdownDetails(TradingMode.LOCKDOWN, measures, maxDrawdown));
        }

        BigDecimal maxDrawdownDollars = loss.getMaxDrawdownDollars();
        if (maxDrawdownDollars != null && drawdownDollars.compareTo(maxDrawdownDollars) > 0) {
            return RiskDecision.fail(
                    NAME,
                    "Drawdown $" + RiskMath.money(drawdownDollars) + " exceeds max ($"
                            + RiskMath.money(maxDrawdownDollars) + ")",
                    RiskMath.ratio(drawdownDollars, maxDrawdownDollars),
                    drawdownDetails(TradingMode.LOCKDOWN, measures, maxDrawdownDollars));
        }

        BigDecimal defensiveThreshold = limits.getModes().getDefensiveDrawdownThreshold();
        TradingMode mode = defensiveThreshold != null && drawdownPct.compareTo(defensiveThreshold) > 0
                ? TradingMode.DEFENSIVE
                : TradingMode.NORMAL;

        BigDecimal dailyLossPct = dailyPct.negate().max(BigDecimal.ZERO);
        double score = Math.max(
                Math.max(
                        maxDailyLoss != null ? RiskMath.ratio(dailyLoss, maxDailyLoss) : 0.0,
                        maxDailyLossPct != null ? RiskMath.ratio(dailyLossPct, maxDailyLossPct) : 0.0),
                maxDrawdown != null ? RiskMath.ratio(drawdownPct, maxDrawdown) : 0.0);

        Map<String, Object> details = drawdownDetails(mode, measures, null);
        details.put("realizedPnl", dailyPnl);
        details.put("consecutiveLosses", streak);
        return RiskDecision.pass(NAME, score, details);
    }

    private static Map<String, Object> drawdownDetails(TradingMode mode, LossMeasures measures, Object limit) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("peakEquity", measures.getPeakEquity());
        details.put("currentEquity", measures.getCurrentEquity());
        details.put("drawdown", measures.getDrawdownDollars());
        details.put("drawdownPct", measures.getDrawdownPct());
        if (limit != null) {
            details.put("limit", limit);
        }
        details.put("mode", mode.name());
        return details;
    }

    private static Map<String, Object> details(TradingMode mode, Object... keyValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put((String) keyValues[i], keyValues[i + 1]);
        }
        details.put("mode", mode.name());
        return details;
    }
}
