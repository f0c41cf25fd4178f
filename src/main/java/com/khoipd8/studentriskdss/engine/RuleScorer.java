package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.RiskBreakdown;
import com.khoipd8.studentriskdss.model.RiskComponent;
import com.khoipd8.studentriskdss.model.RiskTier;
import com.khoipd8.studentriskdss.model.ScoringRule;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

import static com.khoipd8.studentriskdss.model.RiskComponent.*;

/**
 * Point-based risk scoring.
 *
 * <p>All four sub-scores come from one ordered rule table. For banded components
 * (APS, ARS) the first matching rule gives the score; for FSR and LRS every matching
 * rule adds its points. Exactly 15 absences falls in the 1-point attendance band.</p>
 */
@Component
public class RuleScorer {

    public static final int HIGH_RISK_SCORE = 8;
    public static final int MODERATE_RISK_SCORE = 4;

    private static final List<ScoringRule> RULES = List.of(
            rule(ACADEMIC, "G2 < 10", 4, "Critical", f -> f.getG2() < 10),
            rule(ACADEMIC, "10 ≤ G2 ≤ 11", 2, "Moderate", f -> f.getG2() >= 10 && f.getG2() <= 11),
            rule(ACADEMIC, "G2 > 11", 0, "Good", f -> f.getG2() > 11),

            rule(ATTENDANCE, "absences > 15", 3, "High", f -> f.getAbsences() > 15),
            rule(ATTENDANCE, "5 ≤ absences ≤ 15", 1, "Moderate", f -> f.getAbsences() >= 5 && f.getAbsences() <= 15),
            rule(ATTENDANCE, "absences < 5", 0, "Good", f -> f.getAbsences() < 5),

            rule(FAMILY_SUPPORT, "famsup = no", 2, "High", f -> !f.hasFamilySupport()),
            rule(FAMILY_SUPPORT, "parent_edu ≤ 2", 1, "Moderate", f -> f.parentEducationAverage() <= 2),

            rule(LIFESTYLE, "avg_alcohol ≥ 4", 2, "High", f -> f.alcoholAverage() >= 4),
            rule(LIFESTYLE, "goout ≥ 4", 1, "Moderate", f -> f.getGoout() >= 4),
            rule(LIFESTYLE, "studytime = 1", 2, "High", f -> f.getStudytime() == 1)
    );

    public RiskBreakdown score(StudentFeatures features) {
        return new RiskBreakdown(
                academicScore(features),
                attendanceScore(features),
                familySupportScore(features),
                lifestyleScore(features));
    }

    public int totalRisk(StudentFeatures features) {
        return score(features).getTotal();
    }

    public int academicScore(StudentFeatures features) {
        return evaluate(ACADEMIC, features);
    }

    public int attendanceScore(StudentFeatures features) {
        return evaluate(ATTENDANCE, features);
    }

    public int familySupportScore(StudentFeatures features) {
        return evaluate(FAMILY_SUPPORT, features);
    }

    public int lifestyleScore(StudentFeatures features) {
        return evaluate(LIFESTYLE, features);
    }

    public RiskTier classify(int totalScore) {
        if (totalScore >= HIGH_RISK_SCORE) {
            return RiskTier.HIGH;
        } else if (totalScore >= MODERATE_RISK_SCORE) {
            return RiskTier.MODERATE;
        }
        return RiskTier.LOW;
    }

    /**
     * The rule table in evaluation order, for documentation endpoints.
     */
    public List<ScoringRule> getRules() {
        return RULES;
    }

    private int evaluate(RiskComponent component, StudentFeatures features) {
        int points = 0;
        for (ScoringRule rule : RULES) {
            if (rule.getComponent() != component || !rule.matches(features)) {
                continue;
            }
            if (component.isBanded()) {
                return rule.getPoints();
            }
            points += rule.getPoints();
        }
        return points;
    }

    private static ScoringRule rule(RiskComponent component, String condition, int points,
                                    String severity, Predicate<StudentFeatures> predicate) {
        return new ScoringRule(component, condition, points, severity, predicate);
    }
}
