package com.riskledger.risk;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Result of running the rule chain: the final decision plus every decision actually
 * evaluated, in chain order. Rules after the first failure do not appear.
 */
@Value
public class RiskEvaluation {

    RiskDecision decision;
    List<RiskDecision> evaluated;
    Map<String, Double> scores;

    public boolean isApproved() {
        return decision.isPassed();
    }
}
