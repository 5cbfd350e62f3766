package com.ironcondor.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-factor grade shown next to the quality score. Return-on-risk and probability
 * use GOOD/FAIR/POOR; time to expiration uses OPTIMAL/ACCEPTABLE/RISKY.
 */
public enum FactorGrade {
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    OPTIMAL("Optimal"),
    ACCEPTABLE("Acceptable"),
    RISKY("Risky");

    private final String label;

    FactorGrade(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
