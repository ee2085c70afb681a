package com.riskledger.risk;

/**
 * One admission check. Implementations are stateless: the verdict depends only on the
 * context passed in, never on anything remembered from an earlier call.
 */
public interface RiskRule {

    /** Stable identifier reported as {@link RiskDecision#getRuleName()}. */
    String name();

    RiskDecision evaluate(RiskContext context);
}
