package com.ironcondor.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative rating of a condor, ordered best to worst. Thresholds apply to the
 * rating blend (ROR x 2 x 0.4 + POP x 0.6), not to the 0-100 quality score.
 */
public enum StrategyRating {
    EXCELLENT("Excellent", 80.0),
    GOOD("Good", 65.0),
    FAIR("Fair", 50.0),
    POOR("Poor", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minimumBlend;

    StrategyRating(String label, double minimumBlend) {
        this.label = label;
        this.minimumBlend = minimumBlend;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static StrategyRating fromBlend(double blend) {
        for (StrategyRating rating : values()) {
            if (blend >= rating.minimumBlend) {
                return rating;
            }
        }
        return POOR;
    }
}
