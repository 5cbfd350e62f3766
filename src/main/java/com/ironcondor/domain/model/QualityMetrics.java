package com.ironcondor.domain.model;

import com.ironcondor.domain.enums.FactorGrade;
import com.ironcondor.domain.enums.StrategyRating;
import lombok.Builder;
import lombok.Value;

/**
 * Output of the strategy scorer. {@code score} and {@code rating} come from two
 * independent weightings and can disagree.
 */
@Value
@Builder
public class QualityMetrics {

    /** 0-100, rounded to 2 decimals. */
    double score;

    StrategyRating rating;

    Factors factors;

    @Value
    @Builder
    public static class Factors {
        FactorGrade returnOnRisk;
        FactorGrade probabilityOfProfit;
        FactorGrade timeToExpiration;
    }
}
