package com.riskledger.risk;

import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.PortfolioState;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Derives a session's trading mode from its ledger and daily stats. Nothing is stored:
 * the same inputs always give the same mode.
 *
 * <p>LOCKDOWN when any hard limit is breached (daily loss in dollars or percent, drawdown
 * in percent or dollars). Otherwise DEFENSIVE on a losing streak at its limit or drawdown
 * above the defensive threshold. Otherwise NORMAL.
 */
@Component
public class ModeController {

    public TradingMode resolve(PortfolioState portfolio, DailyStats stats, RiskLimits limits) {
        return assess(portfolio, stats, limits).getMode();
    }

    public String describe(PortfolioState portfolio, DailyStats stats, RiskLimits limits) {
        return assess(portfolio, stats, limits).getReason();
    }

    public ModeAssessment assess(PortfolioState portfolio, DailyStats stats, RiskLimits limits) {
        LossMeasures measures = LossMeasures.of(portfolio, stats, limits);
        RiskLimits.LossLimits loss = limits.getLoss();

        BigDecimal maxDailyLoss = loss.getMaxDailyLoss();
        if (maxDailyLoss != null && measures.getDailyRealizedPnl().compareTo(maxDailyLoss.negate()) < 0) {
            return lockdown("Daily loss $" + RiskMath.money(measures.getDailyRealizedPnl().negate())
                    + " exceeds limit $" + RiskMath.money(maxDailyLoss), measures);
        }
        BigDecimal maxDailyLossPct = loss.getMaxDailyLossPct();
        if (maxDailyLossPct != null && measures.getDailyPnlPct().compareTo(maxDailyLossPct.negate()) < 0) {
            return lockdown("Daily loss " + RiskMath.percent(measures.getDailyPnlPct().negate(), 2)
                    + "% exceeds limit " + RiskMath.percent(maxDailyLossPct, 2) + "%", measures);
        }
        BigDecimal maxDrawdown = loss.getMaxDrawdown();
        if (maxDrawdown != null && measures.getDrawdownPct().compareTo(maxDrawdown) > 0) {
            return lockdown("Drawdown " + RiskMath.percent(measures.getDrawdownPct(), 2) + "% exceeds max "
                    + RiskMath.percent(maxDrawdown, 2) + "%", measures);
        }
        BigDecimal maxDrawdownDollars = loss.getMaxDrawdownDollars();
        if (maxDrawdownDollars != null && measures.getDrawdownDollars().compareTo(maxDrawdownDollars) > 0) {
            return lockdown("Drawdown $" + RiskMath.money(measures.getDrawdownDollars()) + " exceeds max $"
                    + RiskMath.money(maxDrawdownDollars), measures);
        }

        Integer maxStreak = loss.getMaxConsecutiveLosses();
        if (maxStreak != null && measures.getConsecutiveLosses() >= maxStreak) {
            return new ModeAssessment(
                    TradingMode.DEFENSIVE,
                    measures.getConsecutiveLosses() + " consecutive losses (limit " + maxStreak + ")",
                    measures);
        }
        BigDecimal threshold = limits.getModes().getDefensiveDrawdownThreshold();
        if (threshold != null && measures.getDrawdownPct().compareTo(threshold) > 0) {
            return new ModeAssessment(
                    TradingMode.DEFENSIVE,
                    "Drawdown " + RiskMath.percent(measures.getDrawdownPct(), 2) + "% above defensive threshold "
                            + RiskMath.percent(threshold, 2) + "%",
                    measures);
        }

        return new ModeAssessment(TradingMode.NORMAL, "All limits within bounds", measures);
    }

    private static ModeAssessment lockdown(String reason, LossMeasures measures) {
        return new ModeAssessment(TradingMode.LOCKDOWN, reason, measures);
    }
}
