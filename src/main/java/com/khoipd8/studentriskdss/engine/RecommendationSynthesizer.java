package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.RiskTier;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the ordered intervention list for a student.
 *
 * <p>Order: attendance, failures, study time, grade, family support, tier closer,
 * and last the classifier note. The Low-tier default only appears when nothing
 * else was recommended.</p>
 */
@Component
public class RecommendationSynthesizer {

    public static final String CRITICAL_ATTENDANCE = "⚠️ Critical attendance issue - mandatory attendance counseling";
    public static final String MONITOR_ATTENDANCE = "⏰ Monitor attendance closely";
    public static final String REMEDIATION = "📚 Academic remediation program required";
    public static final String ACADEMIC_SUPPORT = "📖 Academic support recommended";
    public static final String STUDY_SKILLS = "⏱️ Study skills workshop - very low study time detected";
    public static final String TUTORING = "📉 Immediate tutoring for failing grades";
    public static final String PARENTAL_ENGAGEMENT = "👨‍👩‍👧 Parental engagement initiative";
    public static final String COUNSELOR_MEETING = "🚨 URGENT: Schedule intervention meeting with counselor";
    public static final String CONTACT_GUARDIANS = "📞 Contact parents/guardians immediately";
    public static final String REGULAR_MONITORING = "📊 Regular monitoring and check-ins";
    public static final String CONTINUE_TRAJECTORY = "✅ Continue current trajectory";

    public static final double ML_NOTE_PROBABILITY = 0.7;

    public List<String> synthesize(StudentFeatures features, RiskTier finalTier) {
        return synthesize(features, finalTier, null);
    }

    /**
     * @param probability classifier failure probability, or null when unavailable
     */
    public List<String> synthesize(StudentFeatures features, RiskTier finalTier, Double probability) {
        List<String> recommendations = new ArrayList<>();

        if (features.getAbsences() > 15) {
            recommendations.add(CRITICAL_ATTENDANCE);
        } else if (features.getAbsences() > 5) {
            recommendations.add(MONITOR_ATTENDANCE);
        }

        if (features.getFailures() > 1) {
            recommendations.add(REMEDIATION);
        } else if (features.getFailures() == 1) {
            recommendations.add(ACADEMIC_SUPPORT);
        }

        if (features.getStudytime() == 1) {
            recommendations.add(STUDY_SKILLS);
        }

        if (features.getG2() < 10) {
            recommendations.add(TUTORING);
        }

        if (!features.hasFamilySupport()) {
            recommendations.add(PARENTAL_ENGAGEMENT);
        }

        switch (finalTier) {
            case HIGH -> {
                recommendations.add(COUNSELOR_MEETING);
                recommendations.add(CONTACT_GUARDIANS);
            }
            case MODERATE -> recommendations.add(REGULAR_MONITORING);
            default -> {
                if (recommendations.isEmpty()) {
                    recommendations.add(CONTINUE_TRAJECTORY);
                }
            }
        }

        if (probability != null && probability > ML_NOTE_PROBABILITY) {
            recommendations.add(mlNote(probability));
        }
        return recommendations;
    }

    static String mlNote(double probability) {
        return String.format(Locale.ROOT,
                "🤖 ML model predicts %.1f%% failure probability - close monitoring advised", probability * 100);
    }
}
