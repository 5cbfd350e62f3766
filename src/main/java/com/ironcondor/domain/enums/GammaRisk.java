package com.ironcondor.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucketed magnitude of portfolio gamma: LOW below 0.1, MODERATE below 0.5, HIGH otherwise.
 */
public enum GammaRisk {
    LOW,
    MODERATE,
    HIGH;

    public static GammaRisk of(double portfolioGamma) {
        double magnitude = Math.abs(portfolioGamma);
        if (magnitude < 0.1) {
            return LOW;
        }
        if (magnitude < 0.5) {
            return MODERATE;
        }
        return HIGH;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
