package com.khoipd8.studentriskdss.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rule sub-scores of one student.
 */
@Value
public class RiskBreakdown {

    int aps;
    int ars;
    int fsr;
    int lrs;

    public int getTotal() {
        return aps + ars + fsr + lrs;
    }

    public int get(RiskComponent component) {
        return switch (component) {
            case ACADEMIC -> aps;
            case ATTENDANCE -> ars;
            case FAMILY_SUPPORT -> fsr;
            case LIFESTYLE -> lrs;
        };
    }

    public Map<String, Integer> toMap() {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (RiskComponent component : RiskComponent.values()) {
            scores.put(component.getCode(), get(component));
        }
        return scores;
    }
}
