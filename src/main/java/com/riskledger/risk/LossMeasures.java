package com.riskledger.risk;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.PortfolioState;
import java.math.BigDecimal;
import lombok.Value;

/**
 * Loss and drawdown figures derived from a ledger snapshot and a daily-stats snapshot.
 * Shared by {@link com.riskledger.risk.rules.LossLimitRule} and {@link ModeController}
 * so both always measure the account the same way.
 */
@Value
public class LossMeasures {

    BigDecimal dailyRealizedPnl;

    /** Daily realized P&L as a fraction of initial capital; negative when losing. */
    BigDecimal dailyPnlPct;

    BigDecimal peakEquity;
    BigDecimal currentEquity;

    /** Peak minus current equity, never negative. */
    BigDecimal drawdownDollars;

    BigDecimal drawdownPct;

    int consecutiveLosses;

    public static LossMeasures of(PortfolioState portfolio, DailyStats stats, RiskLimits limits) {
        RiskLimits.Capital capital = limits.getCapital();

        BigDecimal initialCapital = portfolio != null && isPositive(portfolio.getInitialCapital())
                ? portfolio.getInitialCapital()
                : capital.getInitialCapital();

        BigDecimal currentEquity = portfolio != null && portfolio.getPortfolioValue() != null
                ? portfolio.getPortfolioValue()
                : firstPositive(capital.getCurrentEquity(), initialCapital);

        BigDecimal peakEquity = portfolio != null && isPositive(portfolio.getPeakValue())
                ? portfolio.getPeakValue()
                : firstPositive(capital.getPeakEquity(), initialCapital);

        BigDecimal drawdownDollars = peakEquity.subtract(currentEquity).max(BigDecimal.ZERO);
        BigDecimal dailyPnl = stats.getRealizedPnl() != null ? stats.getRealizedPnl() : BigDecimal.ZERO;

        return new LossMeasures(
                dailyPnl,
                RiskMath.fraction(dailyPnl, initialCapital),
                peakEquity,
                currentEquity,
                drawdownDollars,
                RiskMath.fraction(drawdownDollars, peakEquity),
                stats.getConsecutiveLosses());
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal firstPositive(BigDecimal preferred, BigDecimal fallback) {
        return isPositive(preferred) ? preferred : fallback;
    }
}
