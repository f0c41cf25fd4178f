package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.RiskTier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationPolicyTest {

    private final ReconciliationPolicy policy = new ReconciliationPolicy();
    private final RuleScorer scorer = new RuleScorer();

    @Test
    void high_probability_escalates_low_rule_score() {
        assertEquals(RiskTier.HIGH, policy.reconcile(2, 0.7));
    }

    @Test
    void moderate_probability_escalates_to_moderate() {
        assertEquals(RiskTier.MODERATE, policy.reconcile(0, 0.5));
        assertEquals(RiskTier.MODERATE, policy.reconcile(0, 0.65));
    }

    @Test
    void thresholds_are_strict() {
        assertEquals(RiskTier.LOW, policy.reconcile(0, 0.4));
        assertEquals(RiskTier.MODERATE, policy.reconcile(0, 0.4001));
        assertEquals(RiskTier.HIGH, policy.reconcile(0, 0.6501));
    }

    @Test
    void low_probability_never_lowers_rule_tier() {
        assertEquals(RiskTier.HIGH, policy.reconcile(12, 0.01));
        assertEquals(RiskTier.MODERATE, policy.reconcile(5, 0.0));
    }

    @Test
    void zero_probability_reproduces_rule_tier() {
        for (int score = 0; score <= 15; score++) {
            assertEquals(scorer.classify(score), policy.reconcile(score, 0.0));
        }
    }

    @Test
    void final_tier_is_at_least_both_signals() {
        double[] probabilities = {0.0, 0.2, 0.4, 0.41, 0.6, 0.65, 0.66, 0.9, 1.0};
        for (int score = 0; score <= 15; score++) {
            for (double p : probabilities) {
                RiskTier tier = policy.reconcile(score, p);
                assertTrue(tier.isAtLeast(scorer.classify(score)));
                assertTrue(tier.isAtLeast(policy.reconcile(0, p)));
            }
        }
    }
}
