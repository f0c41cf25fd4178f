package com.khoipd8.studentriskdss.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Final-tier distribution of a completed run.
 */
@Value
@Builder
public class SummaryStatistics {

    int totalStudents;
    int highRisk;
    int moderateRisk;
    int lowRisk;
    boolean mlEnabled;
    ModelSource modelSource;
    int rejectedRecords;
    int changedByClassifier;

    public double getHighRiskPct() {
        return percentage(highRisk);
    }

    public double getModerateRiskPct() {
        return percentage(moderateRisk);
    }

    public double getLowRiskPct() {
        return percentage(lowRisk);
    }

    private double percentage(int count) {
        if (totalStudents == 0) {
            return 0.0;
        }
        return Math.round(count * 1000.0 / totalStudents) / 10.0;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_students", totalStudents);
        stats.put("high_risk", highRisk);
        stats.put("moderate_risk", moderateRisk);
        stats.put("low_risk", lowRisk);
        stats.put("high_risk_pct", getHighRiskPct());
        stats.put("moderate_risk_pct", getModerateRiskPct());
        stats.put("low_risk_pct", getLowRiskPct());
        stats.put("ml_enabled", mlEnabled);
        stats.put("model_source", modelSource.name().toLowerCase(Locale.ROOT));
        stats.put("rejected_records", rejectedRecords);
        stats.put("changed_by_ml", changedByClassifier);
        return stats;
    }
}
