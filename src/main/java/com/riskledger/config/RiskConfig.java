package com.riskledger.config;

import com.riskledger.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.yml.
 *
 * <p>Individual limits default to null (check disabled) when the property is absent.
 * Capital and mode policy have defaults because the loss and mode calculations need a
 * baseline even on a fresh session.
 *
 * <p>Properties prefix: {@code risk-ledger.risk.*}
 */
@Configuration
public class RiskConfig {

    private static final String P = "risk-ledger.risk.";

    @Bean
    public RiskLimits riskLimits(
            @Value("${" + P + "frequency-limits.max-trades-per-day:#{null}}") Integer maxTradesPerDay,
            @Value("${" + P + "frequency-limits.min-time-between-trades:#{null}}") Integer minTimeBetweenTrades,
            @Value("${" + P + "frequency-limits.max-trades-per-symbol:#{null}}") Integer maxTradesPerSymbol,
            @Value("${" + P + "frequency-limits.max-trades-per-minute:#{null}}") Integer maxTradesPerMinute,
            @Value("${" + P + "position-limits.max-shares-per-trade:#{null}}") Integer maxSharesPerTrade,
            @Value("${" + P + "position-limits.max-dollar-value-per-trade:#{null}}") BigDecimal maxDollarValuePerTrade,
            @Value("${" + P + "position-limits.max-position-shares:#{null}}") Integer maxPositionShares,
            @Value("${" + P + "position-limits.max-position-dollars:#{null}}") BigDecimal maxPositionDollars,
            @Value("${" + P + "loss-limits.max-daily-loss:#{null}}") BigDecimal maxDailyLoss,
            @Value("${" + P + "loss-limits.max-daily-loss-pct:#{null}}") BigDecimal maxDailyLossPct,
            @Value("${" + P + "loss-limits.max-consecutive-losses:#{null}}") Integer maxConsecutiveLosses,
            @Value("${" + P + "loss-limits.max-drawdown:#{null}}") BigDecimal maxDrawdown,
            @Value("${" + P + "loss-limits.max-drawdown-dollars:#{null}}") BigDecimal maxDrawdownDollars,
            @Value("${" + P + "portfolio-limits.max-portfolio-exposure:#{null}}") BigDecimal maxPortfolioExposure,
            @Value("${" + P + "portfolio-limits.max-single-position-pct:#{null}}") BigDecimal maxSinglePositionPct,
            @Value("${" + P + "portfolio-limits.reserve-cash-pct:#{null}}") BigDecimal reserveCashPct,
            @Value("${" + P + "capital.initial-capital:100000}") BigDecimal initialCapital,
            @Value("${" + P + "capital.current-equity:#{null}}") BigDecimal currentEquity,
            @Value("${" + P + "capital.peak-equity:#{null}}") BigDecimal peakEquity,
            @Value("${" + P + "modes.defensive-drawdown-threshold:0.05}") BigDecimal defensiveDrawdownThreshold,
            @Value("${" + P + "modes.lockdown-halts-trading:true}") boolean lockdownHaltsTrading,
            @Value("${" + P + "modes.defensive-size-factor:0.5}") BigDecimal defensiveSizeFactor) {
        return RiskLimits.builder()
                .frequency(RiskLimits.FrequencyLimits.builder()
                        .maxTradesPerDay(maxTradesPerDay)
                        .minTimeBetweenTrades(minTimeBetweenTrades)
                        .maxTradesPerSymbol(maxTradesPerSymbol)
                        .maxTradesPerMinute(maxTradesPerMinute)
                        .build())
                .position(RiskLimits.PositionLimits.builder()
                        .maxSharesPerTrade(maxSharesPerTrade)
                        .maxDollarValuePerTrade(maxDollarValuePerTrade)
                        .maxPositionShares(maxPositionShares)
                        .maxPositionDollars(maxPositionDollars)
                        .build())
                .loss(RiskLimits.LossLimits.builder()
                        .maxDailyLoss(maxDailyLoss)
                        .maxDailyLossPct(maxDailyLossPct)
                        .maxConsecutiveLosses(maxConsecutiveLosses)
                        .maxDrawdown(maxDrawdown)
                        .maxDrawdownDollars(maxDrawdownDollars)
                        .build())
                .portfolio(RiskLimits.PortfolioLimits.builder()
                        .maxPortfolioExposure(maxPortfolioExposure)
                        .maxSinglePositionPct(maxSinglePositionPct)
                        .reserveCashPct(reserveCashPct)
                        .build())
                .capital(RiskLimits.Capital.builder()
                        .initialCapital(initialCapital)
                        .currentEquity(currentEquity)
                        .peakEquity(peakEquity)
                        .build())
                .modes(RiskLimits.ModePolicy.builder()
                        .defensiveDrawdownThreshold(defensiveDrawdownThreshold)
                        .lockdownHaltsTrading(lockdownHaltsTrading)
                        .defensiveSizeFactor(defensiveSizeFactor)
                        .build())
                .build();
    }
}
