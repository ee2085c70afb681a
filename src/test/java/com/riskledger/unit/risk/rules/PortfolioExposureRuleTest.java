package com.riskledger.unit.risk.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskledger.domain.model.PortfolioState;
import com.riskledger.domain.model.TradeSignal;
import com.riskledger.risk.RiskDecision;
import com.riskledger.risk.RiskLimits;
import com.riskledger.risk.RiskLimits.PortfolioLimits;
import com.riskledger.risk.rules.PortfolioExposureRule;
import com.riskledger.unit.support.TestData;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PortfolioExposureRuleTest {

    private final PortfolioExposureRule rule = new PortfolioExposureRule();

    private static RiskLimits limits(String maxExposure, String maxSingle, String reserve) {
        return RiskLimits.builder()
                .portfolio(PortfolioLimits.builder()
                        .maxPortfolioExposure(maxExposure != null ? new BigDecimal(maxExposure) : null)
                        .maxSinglePositionPct(maxSingle != null ? new BigDecimal(maxSingle) : null)
                        .reserveCashPct(reserve != null ? new BigDecimal(reserve) : null)
                        .build())
                .build();
    }

    private RiskDecision evaluate(TradeSignal signal, PortfolioState portfolio, RiskLimits limits) {
        return rule.evaluate(TestData.context(signal, portfolio, TestData.emptyStats(), limits));
    }

    @Test
    @DisplayName("BUY pushing total exposure past the limit is rejected")
    void totalExposure_exceeded() {
        PortfolioState portfolio = TestData.holding("100000", "SPY", 900, "100");

        RiskDecision decision = evaluate(TestData.buy("QQQ", 100, "100"), portfolio, limits("0.95", null, null));

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason()).isEqualTo("Portfolio exposure 100.0% would exceed max (95.0%)");
        assertThat(decision.getDetails()).containsKeys("currentExposure", "projectedExposure", "exposurePct");
    }

    @Test
    @DisplayName("BUY concentrating one symbol past its weight limit is rejected")
    void singlePosition_exceeded() {
        RiskDecision decision = evaluate(
                TestData.buy("AAPL", 300, "100"), TestData.cashOnly("100000"), limits("0.95", "0.25", "0.05"));

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason())
                .isEqualTo("Position in AAPL would be 30.0% of portfolio, exceeds max (25.0%)");
        assertThat(decision.getScore()).isEqualTo(1.2);
    }

    @Test
    @DisplayName("BUY leaving less than the cash reserve is rejected")
    void cashReserve_breached() {
        RiskDecision decision = evaluate(
                TestData.buy("AAPL", 960, "100"), TestData.cashOnly("100000"), limits("1.0", null, "0.05"));

        assertThat(decision.isPassed()).isFalse();
        assertThat(decision.getReason())
                .isEqualTo("Trade would leave only $4000.00 cash, need $5000.00 reserve (5.0%)");
    }

    @Test
    @DisplayName("SELL always passes")
    void sell_passes() {
        PortfolioState portfolio = TestData.holding("100000", "SPY", 990, "100");

        RiskDecision decision = evaluate(TestData.sell("SPY", 10, "100"), portfolio, limits("0.5", "0.1", "0.5"));

        assertThat(decision.isPassed()).isTrue();
        assertThat(decision.getDetails()).containsEntry("checkSkipped", true);
    }

    @Test
    @DisplayName("Trade within every limit passes with the tighter utilisation as score")
    void withinLimits_passes() {
        RiskDecision decision = evaluate(
                TestData.buy("AAPL", 100, "100"), TestData.cashOnly("100000"), limits("0.5", "0.2", "0.05"));

        assertThat(decision.isPassed()).isTrue();
        assertThat(decision.getScore()).isEqualTo(0.5);
    }
}
