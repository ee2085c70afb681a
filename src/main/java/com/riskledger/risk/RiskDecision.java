package com.riskledger.risk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Verdict of one rule (or of the whole chain, under the name {@value #AGGREGATE}).
 *
 * <p>{@code score} is a utilisation ratio: at or below 1 the limit holds, above 1 it is
 * violated. {@code reason} is null for a passing decision.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RiskDecision {

    public static final String AGGREGATE = "ALL";

    private final String ruleName;
    private final boolean passed;
    private final String reason;
    private final double score;
    private final Map<String, Object> details;

    private RiskDecision(String ruleName, boolean passed, String reason, double score, Map<String, Object> details) {
        this.ruleName = ruleName;
        this.passed = passed;
        this.reason = reason;
        this.score = Double.isFinite(score) ? Math.max(score, 0.0) : Double.MAX_VALUE;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public static RiskDecision pass(String ruleName, double score, Map<String, Object> details) {
        return new RiskDecision(ruleName, true, null, score, details);
    }

    public static RiskDecision fail(String ruleName, String reason, double score, Map<String, Object> details) {
        return new RiskDecision(ruleName, false, reason, score, details);
    }
}
