package com.riskledger.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/**
 * Configurable risk limits, grouped the way the rules consume them.
 *
 * <p>Every individual limit is nullable; a null limit disables that one check and leaves
 * the other checks of the same rule active. Built from {@code risk-ledger.risk.*} by
 * {@link com.riskledger.config.RiskConfig}.
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    @Builder.Default
    FrequencyLimits frequency = FrequencyLimits.builder().build();

    @Builder.Default
    PositionLimits position = PositionLimits.builder().build();

    @Builder.Default
    LossLimits loss = LossLimits.builder().build();

    @Builder.Default
    PortfolioLimits portfolio = PortfolioLimits.builder().build();

    @Builder.Default
    Capital capital = Capital.builder().build();

    @Builder.Default
    ModePolicy modes = ModePolicy.builder().build();

    /**
     * Returns a copy whose per-trade share and dollar limits are multiplied by
     * {@code factor}. Applied while the session is DEFENSIVE.
     */
    public RiskLimits scaledPerTradeLimits(BigDecimal factor) {
        if (factor == null || factor.compareTo(BigDecimal.ONE) == 0) {
            return this;
        }
        PositionLimits scaled = position.toBuilder()
                .maxSharesPerTrade(position.getMaxSharesPerTrade() == null
                        ? null
                        : BigDecimal.valueOf(position.getMaxSharesPerTrade())
                                .multiply(factor)
                                .setScale(0, RoundingMode.FLOOR)
                                .intValue())
                .maxDollarValuePerTrade(position.getMaxDollarValuePerTrade() == null
                        ? null
                        : position.getMaxDollarValuePerTrade().multiply(factor))
                .build();
        return toBuilder().position(scaled).build();
    }

    @Value
    @Builder(toBuilder = true)
    public static class FrequencyLimits {
        Integer maxTradesPerDay;

        /** Minimum seconds between two admitted trades. */
        Integer minTimeBetweenTrades;

        Integer maxTradesPerSymbol;
        Integer maxTradesPerMinute;
    }

    @Value
    @Builder(toBuilder = true)
    public static class PositionLimits {
        Integer maxSharesPerTrade;
        BigDecimal maxDollarValuePerTrade;
        Integer maxPositionShares;
        BigDecimal maxPositionDollars;
    }

    @Value
    @Builder(toBuilder = true)
    public static class LossLimits {
        BigDecimal maxDailyLoss;

        /** Fraction of initial capital, e.g. 0.05 for 5%. */
        BigDecimal maxDailyLossPct;

        Integer maxConsecutiveLosses;

        /** Fraction of peak equity. */
        BigDecimal maxDrawdown;

        BigDecimal maxDrawdownDollars;
    }

    @Value
    @Builder(toBuilder = true)
    public static class PortfolioLimits {
        BigDecimal maxPortfolioExposure;
        BigDecimal maxSinglePositionPct;
        BigDecimal reserveCashPct;
    }

    /** Account figures used when the ledger has none yet (fresh session, zero peak). */
    @Value
    @Builder(toBuilder = true)
    public static class Capital {
        @Builder.Default
        BigDecimal initialCapital = new BigDecimal("100000");

        BigDecimal currentEquity;
        BigDecimal peakEquity;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ModePolicy {
        @Builder.Default
        BigDecimal defensiveDrawdownThreshold = new BigDecimal("0.05");

        @Builder.Default
        boolean lockdownHaltsTrading = true;

        @Builder.Default
        BigDecimal defensiveSizeFactor = new BigDecimal("0.5");
    }
}
