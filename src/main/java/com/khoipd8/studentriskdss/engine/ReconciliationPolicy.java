package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.RiskTier;
import org.springframework.stereotype.Component;

/**
 * Merges the rule score and the classifier probability into the final tier.
 * Whichever signal is more alarming decides; neither can lower what the other raised.
 * A probability of 0.0 (classifier unavailable) reproduces the rule-only tier.
 */
@Component
public class ReconciliationPolicy {

    public static final double HIGH_RISK_PROBABILITY = 0.65;
    public static final double MODERATE_RISK_PROBABILITY = 0.4;

    public RiskTier reconcile(int totalRuleScore, double probability) {
        if (probability > HIGH_RISK_PROBABILITY || totalRuleScore >= RuleScorer.HIGH_RISK_SCORE) {
            return RiskTier.HIGH;
        } else if (probability > MODERATE_RISK_PROBABILITY || totalRuleScore >= RuleScorer.MODERATE_RISK_SCORE) {
            return RiskTier.MODERATE;
        }
        return RiskTier.LOW;
    }
}
