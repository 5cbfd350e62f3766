package com.ironcondor.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for "optimize then analyze": where the underlying is, how volatile it is,
 * and what probability of profit and wing width the trader wants.
 */
@Value
@Builder
public class OptimizationCriteria {

    String symbol;
    LocalDate expirationDate;
    double currentPrice;
    double impliedVolatility;

    /** Target probability of profit in [0.5, 0.95]. */
    double targetProbability;

    double wingWidth;
    int contracts;
    double riskFreeRate;
}
