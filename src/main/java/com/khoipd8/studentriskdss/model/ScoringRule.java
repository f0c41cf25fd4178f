package com.khoipd8.studentriskdss.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.function.Predicate;

/**
 * One row of the rule table: when {@code condition} holds for a student,
 * {@code points} count towards {@code component}.
 */
@Value
public class ScoringRule {

    RiskComponent component;
    String condition;
    int points;
    String severity;
    @JsonIgnore
    Predicate<StudentFeatures> predicate;

    public boolean matches(StudentFeatures features) {
        return predicate.test(features);
    }
}
