package com.riskledger.risk;

import com.riskledger.risk.rules.BuyingPowerRule;
import com.riskledger.risk.rules.FrequencyRule;
import com.riskledger.risk.rules.LossLimitRule;
import com.riskledger.risk.rules.PortfolioExposureRule;
import com.riskledger.risk.rules.PositionLimitRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the admission rules in a fixed order and stops at the first failure.
 *
 * <p>Order: frequency, position limits, buying power, loss limits, portfolio exposure.
 * A rejection carries the failing rule's reason and details unchanged. When every rule
 * passes, the result is an aggregate decision named {@value RiskDecision#AGGREGATE} whose
 * score is the highest individual score, i.e. the limit closest to being hit.
 */
@Component
public class RiskRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskRuleEngine.class);

    private final List<RiskRule> rules;

    @Autowired
    public RiskRuleEngine(
            FrequencyRule frequencyRule,
            PositionLimitRule positionLimitRule,
            BuyingPowerRule buyingPowerRule,
            LossLimitRule lossLimitRule,
            PortfolioExposureRule portfolioExposureRule) {
        this(List.of(frequencyRule, positionLimitRule, buyingPowerRule, lossLimitRule, portfolioExposureRule));
    }

    public RiskRuleEngine(List<RiskRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public RiskEvaluation evaluate(RiskContext context) {
        List<RiskDecision> evaluated = new ArrayList<>(rules.size());
        Map<String, Double> scores = new LinkedHashMap<>();

        for (RiskRule rule : rules) {
            RiskDecision decision = rule.evaluate(context);
            evaluated.add(decision);
            scores.put(rule.name(), decision.getScore());

            if (!decision.isPassed()) {
                log.debug(
                        "Rule {} rejected {} {} x{}: {}",
                        rule.name(),
                        context.getSignal().getAction(),
                        context.getSignal().getSymbol(),
                        context.getSignal().getQuantity(),
                        decision.getReason());
                return new RiskEvaluation(
                        decision, Collections.unmodifiableList(evaluated), Collections.unmodifiableMap(scores));
            }
        }

        double maxScore = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ruleScores", new LinkedHashMap<>(scores));
        RiskDecision aggregate = RiskDecision.pass(RiskDecision.AGGREGATE, maxScore, details);
        return new RiskEvaluation(aggregate, Collections.unmodifiableList(evaluated), Collections.unmodifiableMap(scores));
    }

    public List<String> ruleNames() {
        return rules.stream().map(RiskRule::name).toList();
    }
}
