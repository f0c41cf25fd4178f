package com.khoipd8.studentriskdss.engine;

import com.khoipd8.studentriskdss.model.RiskTier;
import com.khoipd8.studentriskdss.model.StudentFeatures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.khoipd8.studentriskdss.StudentFixtures.*;
import static com.khoipd8.studentriskdss.engine.RecommendationSynthesizer.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RecommendationSynthesizerTest {

    private final FeatureExtractor extractor = new FeatureExtractor();
    private final RecommendationSynthesizer synthesizer = new RecommendationSynthesizer();

    @Test
    void healthy_student_gets_only_the_default() {
        List<String> recommendations = synthesizer.synthesize(extractor.extract(bestCase()), RiskTier.LOW);

        assertEquals(List.of(CONTINUE_TRAJECTORY), recommendations);
    }

    @Test
    void default_is_suppressed_when_something_else_applies() {
        StudentFeatures features = extractor.extract(record("G2", 14, "absences", 6, "Medu", 4, "Fedu", 4));

        assertEquals(List.of(MONITOR_ATTENDANCE), synthesizer.synthesize(features, RiskTier.LOW));
    }

    @Test
    void recommendations_follow_fixed_order() {
        StudentFeatures features = extractor.extract(record("G2", 8, "absences", 12, "failures", 2,
                "studytime", 1, "famsup", "no"));

        assertEquals(List.of(MONITOR_ATTENDANCE, REMEDIATION, STUDY_SKILLS, TUTORING, PARENTAL_ENGAGEMENT,
                REGULAR_MONITORING), synthesizer.synthesize(features, RiskTier.MODERATE));
    }

    @Test
    void high_tier_ends_with_counselor_and_guardians() {
        List<String> recommendations = synthesizer.synthesize(extractor.extract(worstCase()), RiskTier.HIGH);

        assertEquals(List.of(CRITICAL_ATTENDANCE, REMEDIATION, STUDY_SKILLS, TUTORING, PARENTAL_ENGAGEMENT,
                COUNSELOR_MEETING, CONTACT_GUARDIANS), recommendations);
        assertThat(recommendations).doesNotContain(CONTINUE_TRAJECTORY, REGULAR_MONITORING);
    }

    @Test
    void single_failure_gets_academic_support() {
        StudentFeatures features = extractor.extract(record("G2", 14, "absences", 0, "failures", 1));

        assertThat(synthesizer.synthesize(features, RiskTier.LOW)).containsExactly(ACADEMIC_SUPPORT);
    }

    @Test
    void confident_classifier_adds_note_last() {
        List<String> recommendations = synthesizer.synthesize(extractor.extract(bestCase()), RiskTier.HIGH, 0.8234);

        assertEquals("🤖 ML model predicts 82.3% failure probability - close monitoring advised",
                recommendations.get(recommendations.size() - 1));
    }

    @Test
    void no_note_at_or_below_threshold() {
        StudentFeatures features = extractor.extract(bestCase());

        assertThat(synthesizer.synthesize(features, RiskTier.HIGH, 0.7)).noneMatch(r -> r.startsWith("🤖"));
        assertThat(synthesizer.synthesize(features, RiskTier.HIGH, null)).noneMatch(r -> r.startsWith("🤖"));
    }
}
