package com.riskledger.risk;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Ratio and formatting helpers shared by the rules. */
public final class RiskMath {

    private RiskMath() {}

    /** {@code numerator / denominator} as a double; zero when the denominator is null or zero. */
    public static double ratio(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() == 0) {
            return 0.0;
        }
        return numerator.divide(denominator, MathContext.DECIMAL64).doubleValue();
    }

    public static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    /** Fraction as a decimal, for comparisons against fractional limits. */
    public static BigDecimal fraction(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, MathContext.DECIMAL64);
    }

    public static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** 0.0512 becomes "5.12". */
    public static String percent(BigDecimal fraction, int decimals) {
        return fraction.movePointRight(2).setScale(decimals, RoundingMode.HALF_UP).toPlainString();
    }
}
