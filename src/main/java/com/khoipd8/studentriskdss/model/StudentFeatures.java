package com.khoipd8.studentriskdss.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Normalized, typed view of a {@link StudentRecord}. Shared by the rule scorer,
 * the classifier and the recommendation synthesizer.
 */
@Value
@Builder
public class StudentFeatures {

    double g1;
    double g2;
    // null when the final grade is not known yet
    Double g3;
    int absences;
    int studytime;
    int failures;
    String famsup;
    int medu;
    int fedu;
    int dalc;
    int walc;
    int goout;

    /** Fields that were missing on the record and filled with their documented default. */
    @Singular("defaulted")
    Set<String> defaultedFields;

    public boolean isDefaulted(String field) {
        return defaultedFields.contains(field);
    }

    public double parentEducationAverage() {
        return (medu + fedu) / 2.0;
    }

    public double alcoholAverage() {
        return (dalc + walc) / 2.0;
    }

    public boolean hasFamilySupport() {
        return !"no".equals(famsup);
    }
}
