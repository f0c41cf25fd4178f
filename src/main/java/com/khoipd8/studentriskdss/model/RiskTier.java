package com.khoipd8.studentriskdss.model;

/**
 * Risk tiers in ascending order of severity; {@link #compareTo} follows that order.
 */
public enum RiskTier {
    LOW("Low Risk"),
    MODERATE("Moderate Risk"),
    HIGH("High Risk");

    private final String label;

    RiskTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isAtRisk() {
        return this != LOW;
    }

    public boolean isAtLeast(RiskTier other) {
        return compareTo(other) >= 0;
    }
}
