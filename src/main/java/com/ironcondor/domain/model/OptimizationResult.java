package com.ironcondor.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OptimizationResult {

    StrikeSet optimalStrikes;

    /** Full analysis of a condor opened at {@link #optimalStrikes}. */
    IronCondorAnalysis expectedPerformance;

    Parameters optimizationParameters;

    @Value
    @Builder
    public static class Parameters {
        double targetProbability;
        double wingWidth;
        double currentPrice;
        double impliedVolatility;
        long daysToExpiration;
    }
}
