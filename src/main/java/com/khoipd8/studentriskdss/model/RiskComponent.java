package com.khoipd8.studentriskdss.model;

/**
 * The four rule sub-scores that make up the total risk score.
 */
public enum RiskComponent {
    ACADEMIC("APS", "Academic Performance Score", 4, true),
    ATTENDANCE("ARS", "Attendance Risk Score", 3, true),
    FAMILY_SUPPORT("FSR", "Family Support Risk", 3, false),
    LIFESTYLE("LRS", "Lifestyle Risk Score", 5, false);

    private final String code;
    private final String displayName;
    private final int maxPoints;
    // banded: first matching rule wins; otherwise every matching rule adds up
    private final boolean banded;

    RiskComponent(String code, String displayName, int maxPoints, boolean banded) {
        this.code = code;
        this.displayName = displayName;
        this.maxPoints = maxPoints;
        this.banded = banded;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    public boolean isBanded() {
        return banded;
    }
}
