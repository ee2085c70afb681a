package com.riskledger.unit.risk.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskledger.domain.model.DailyStats;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.ledger.PortfolioLedger;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskLimits.LossLimits;
import com.riskledger.risk.rules.LossLimitRule;
import com.riskledger.unit.support.TestData;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LossLimitRuleTest {

    private final LossLimitRule rule = new LossLimitRule();

    private final RiskLimits limits = RiskLimits.builder()
            .loss(LossLimits.builder()
                    .maxDailyLoss(new BigDecimal("5000"))
                    .maxDailyLossPct(new BigDecimal("0.05"))
                    .maxConsecutiveLosses(5)
                    .maxDrawdown(new BigDecimal("0.15"))
                    .maxDrawdownDollars(new BigDecimal("15000"))
                    .build())
            .build();

    private RiskDecision evaluate(PortfolioState portfolio, DailyStats stats, RiskLimits riskLimits) {
        return rule.evaluate(TestData.context(TestData.buy("SPY", 1, "450"), portfolio, stats, riskLimits));
    }

    @Test
    @DisplayName("Daily loss beyond the dollar limit rejects and locks the account down")
    void dailyLoss_lockdown() {
        DailyStats stats = TestData.emptyStats().toBuilder().realizedPnl(new BigDecimal("-6000")).build();

        RiskDecision decision = evaluate(TestData.cashOnly("100000"), stats, limits);

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("Daily loss $6000.00 exceeds limit ($5000.00)");
        assertThat(decision.getScore()).isEqualTo(1.2);
        assertThat(decision.getDetails()).containsEntry("mode", "LOCKDOWN");
    }

    @Test
    @DisplayName("Daily loss beyond the percentage limit rejects")
    void dailyLossPct_lockdown() {
        RiskLimits pctOnly = limits.toBuilder()
                .loss(limits.getLoss().toBuilder().maxDailyLoss(null).build())
                .build();
        DailyStats stats = TestData.emptyStats().toBuilder().realizedPnl(new BigDecimal("-6000")).build();

        RiskDecision decision = evaluate(TestData.cashOnly("100000"), stats, pctOnly);

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("Daily loss 6.00% exceeds limit (5.00%)");
    }

    @Test
    @DisplayName("Losing streak at its limit rejects and asks for defensive mode")
    void streak_defensive() {
        DailyStats stats = TestData.emptyStats().toBuilder().consecutiveLosses(5).build();

        RiskDecision decision = evaluate(TestData.cashOnly("100000"), stats, limits);

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("5 consecutive losses, exceeds limit (5)");
        assertThat(decision.getDetails()).containsEntry("mode", "DEFENSIVE");
    }

    @Test
    @DisplayName("Drawdown from peak beyond the limit rejects")
    void drawdown_lockdown() {
        PortfolioLedger ledger = TestData.ledgerHolding("100000", "SPY", 100, "450");
        ledger.updateMarketPrices(Map.of("SPY", new BigDecimal("250")));

        RiskDecision decision = evaluate(ledger.getState(), TestData.emptyStats(), limits);

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("Drawdown 20.00% exceeds max (15.00%)");
        assertThat(decision.getDetails())
                .containsEntry("mode", "LOCKDOWN")
                .containsKeys("peakEquity", "currentEquity", "drawdownPct");
    }

    @Test
    @DisplayName("Drawdown in dollars is checked when the percentage limit is off")
    void drawdownDollars_lockdown() {
        RiskLimits dollarsOnly = limits.toBuilder()
                .loss(limits.getLoss().toBuilder().maxDrawdown(null).build())
                .build();
        PortfolioLedger ledger = TestData.ledgerHolding("100000", "SPY", 100, "450");
        ledger.updateMarketPrices(Map.of("SPY", new BigDecimal("250")));

        RiskDecision decision = evaluate(ledger.getState(), TestData.emptyStats(), dollarsOnly);

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("Drawdown $20000.00 exceeds max ($15000.00)");
    }

    @Test
    @DisplayName("Within limits passes and reports the mode the drawdown implies")
    void withinLimits_passes() {
        PortfolioLedger ledger = TestData.ledgerHolding("100000", "SPY", 100, "450");
        ledger.updateMarketPrices(Map.of("SPY", new BigDecimal("390")));
        DailyStats stats = TestData.emptyStats().toBuilder().realizedPnl(new BigDecimal("-1000")).build();

        RiskDecision decision = evaluate(ledger.getState(), stats, limits);

        assertThat(decision.isPassed()).isTrue();
        assertThat(decision.getDetails())
                .containsEntry("mode", "DEFENSIVE")
                .containsEntry("consecutiveLosses", 0);
    }
}
