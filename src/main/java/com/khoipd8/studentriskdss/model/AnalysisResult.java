package com.khoipd8.studentriskdss.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete assessment of one student: rule breakdown, classifier probability,
 * reconciled tier and recommendations.
 */
@Value
@Builder
public class AnalysisResult {

    public static final String RECOMMENDATION_SEPARATOR = " | ";

    // dataset row, null for ad-hoc evaluations
    Integer index;
    StudentRecord record;
    StudentFeatures features;
    RiskBreakdown breakdown;
    RiskTier ruleTier;
    // null when the classifier was unavailable for this student
    Double mlProbability;
    RiskTier finalTier;
    List<String> recommendations;

    public int getTotalRiskScore() {
        return breakdown.getTotal();
    }

    public boolean isMlAvailable() {
        return mlProbability != null;
    }

    /**
     * Probability handed to reconciliation: 0.0 when the classifier was unavailable.
     */
    public double effectiveProbability() {
        return mlProbability != null ? mlProbability : 0.0;
    }

    /**
     * Flat row used by CSV export and the REST API.
     */
    public Map<String, Object> toExportRow(boolean includeG3, boolean includeProbability) {
        Map<String, Object> row = new LinkedHashMap<>();
        if (index != null) {
            row.put("Index", index);
        }
        row.put("G1", formatGrade(features.getG1()));
        row.put("G2", formatGrade(features.getG2()));
        if (includeG3) {
            row.put("G3", features.getG3() != null ? formatGrade(features.getG3()) : "");
        }
        row.put("Absences", features.getAbsences());
        row.put("Study_Time", features.getStudytime());
        row.put("Failures", features.getFailures());
        row.put("Family_Support", features.getFamsup());
        breakdown.toMap().forEach(row::put);
        row.put("Total_Risk_Score", getTotalRiskScore());
        row.put("Risk_Level", ruleTier.getLabel());
        row.put("FinalRiskLevel", finalTier.getLabel());
        if (includeProbability) {
            row.put("ML_Risk_Probability", effectiveProbability());
        }
        row.put("Recommendations", String.join(RECOMMENDATION_SEPARATOR, recommendations));
        return row;
    }

    private static Object formatGrade(double grade) {
        if (grade == Math.rint(grade) && !Double.isInfinite(grade)) {
            return (long) grade;
        }
        return grade;
    }
}
