package com.riskledger.unit.risk.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskledger.domain.enums.BuyingPowerSource;
import com.riskledger.domain.enums.TradingMode;
import com.riskledger.domain.model.BuyingPowerQuote;
import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.BuyingPowerSettings;
import com.riskledger.risk.RiskContext;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.rules.BuyingPowerRule;
import com.riskledger.unit.support.TestData;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BuyingPowerRuleTest {

    private final BuyingPowerRule rule = new BuyingPowerRule(BuyingPowerSettings.builder().build());

    private static RiskContext context(TradeSignal signal, PortfolioState portfolio, BuyingPowerQuote quote) {
        return RiskContext.builder()
                .signal(signal)
                .portfolio(portfolio)
                .dailyStats(TestData.emptyStats())
                .limits(RiskLimits.builder().build())
                .buyingPower(quote)
                .mode(TradingMode.NORMAL)
                .now(TestData.NOW)
                .build();
    }

    private static BuyingPowerQuote fallback(String buyingPower, String value, String exposure) {
        return BuyingPowerQuote.builder()
                .buyingPower(new BigDecimal(buyingPower))
                .source(BuyingPowerSource.FALLBACK)
                .portfolioValue(new BigDecimal(value))
                .exposure(new BigDecimal(exposure))
                .error("Connection refused")
                .build();
    }

    @Test
    @DisplayName("SELL signals skip the check")
    void sell_skipped() {
        PortfolioState portfolio = TestData.cashOnly("0");

        RiskDecision decision = rule.evaluate(
                context(TestData.sell("AAPL", 10, "150"), portfolio, TestData.authoritative(portfolio)));

        assertThat(decision.isPassed()).isTrue();
        assertThat(decision.getDetails()).containsEntry("checkSkipped", true);
    }

    // ==============================
    // AUTHORITATIVE QUOTES
    // ==============================

    @Nested
    @DisplayName("Authoritative Quotes")
    class Authoritative {

        @Test
        @DisplayName("BUY above buying power is rejected with the shortfall")
        void insufficient_rejected() {
            PortfolioState portfolio = TestData.cashOnly("10000");

            RiskDecision decision = rule.evaluate(
                    context(TestData.buy("AAPL", 100, "150"), portfolio, TestData.authoritative(portfolio)));

            assertThat(decision.isPassed()).isFalse();
            assertThat(decision.getReason()).isEqualTo("Insufficient buying power: need $15000.00, have $10000.00");
            assertThat(decision.getScore()).isEqualTo(1.5);
            assertThat(decision.getDetails())
                    .containsEntry("source", "authoritative")
                    .containsKey("shortfall");
        }

        @Test
        @DisplayName("BUY within buying power passes with utilisation as score")
        void covered_passes() {
            PortfolioState portfolio = TestData.cashOnly("100000");

            RiskDecision decision = rule.evaluate(
                    context(TestData.buy("AAPL", 100, "150"), portfolio, TestData.authoritative(portfolio)));

            assertThat(decision.isPassed()).isTrue();
            assertThat(decision.getScore()).isEqualTo(0.15);
        }
    }

    // ==============================
    // FALLBACK QUOTES
    // ==============================

    @Nested
    @DisplayName("Fallback Quotes")
    class Fallback {

        @Test
        @DisplayName("Fallback quote rejects a trade that would create leverage")
        void leverage_rejected() {
            RiskDecision decision = rule.evaluate(context(
                    TestData.buy("AAPL", 100, "100"), TestData.cashOnly("100000"), fallback("20000", "100000", "95000")));

            assertThat(decision.isPassed()).isFalse();
            assertThat(decision.getReason()).isEqualTo("Trade would create leverage (1.05x), not allowed (fallback)");
            assertThat(decision.getDetails())
                    .containsEntry("source", "fallback")
                    .containsEntry("error", "Connection refused");
        }

        @Test
        @DisplayName("Insufficient fallback figure is flagged in the reason")
        void insufficient_flagged() {
            RiskDecision decision = rule.evaluate(context(
                    TestData.buy("AAPL", 100, "100"), TestData.cashOnly("100000"), fallback("5000", "100000", "95000")));

            assertThat(decision.isPassed()).isFalse();
            assertThat(decision.getReason()).endsWith("(fallback)");
        }

        @Test
        @DisplayName("Unlevered trade on a fallback quote passes by default")
        void unlevered_passes() {
            RiskDecision decision = rule.evaluate(context(
                    TestData.buy("AAPL", 100, "100"), TestData.cashOnly("100000"), fallback("60000", "100000", "40000")));

            assertThat(decision.isPassed()).isTrue();
            assertThat(decision.getDetails()).containsEntry("source", "fallback");
        }

        @Test
        @DisplayName("Fallback approvals can be disabled")
        void approvalsDisabled_rejected() {
            BuyingPowerRule strict = new BuyingPowerRule(
                    BuyingPowerSettings.builder().allowFallbackApproval(false).build());

            RiskDecision decision = strict.evaluate(context(
                    TestData.buy("AAPL", 100, "100"), TestData.cashOnly("100000"), fallback("60000", "100000", "40000")));

            assertThat(decision.isPassed()).isFalse();
            assertThat(decision.getReason()).contains("fallback approvals disabled");
        }
    }
}
