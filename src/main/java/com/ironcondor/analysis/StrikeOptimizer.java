package com.ironcondor.analysis;

import com.ironcondor.domain.model.StrikeSet;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Places the short strikes symmetrically around the current price so that, under the
 * normal terminal-price approximation, the underlying stays between them with the
 * target probability. Wings are added at a fixed width outside the shorts.
 *
 * <pre>
 *   priceStd   = S * sigma * sqrt(T)
 *   z          = N^-1((1 + p) / 2)
 *   shortCall  = S + z * priceStd,  shortPut = S - z * priceStd
 *   longCall   = shortCall + w,     longPut  = shortPut - w
 * </pre>
 *
 * All four strikes are then rounded to the nearest multiple of 5, ties to even,
 * the strike grid the recommendations are quoted on.
 */
@Component
public class StrikeOptimizer {

    public static final double STRIKE_INCREMENT = 5.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * @param currentPrice      underlying price S
     * @param yearsToExpiration T in years
     * @param sigma             implied volatility as a decimal
     * @param targetProbability probability of profit p, expected in [0.5, 0.95]
     * @param wingWidth         distance w &gt; 0 between each short and its long strike
     */
    public StrikeSet optimize(
            double currentPrice, double yearsToExpiration, double sigma, double targetProbability, double wingWidth) {
        double priceStd = currentPrice * sigma * Math.sqrt(yearsToExpiration);
        double zScore = NORM.inverseCumulativeProbability((1.0 + targetProbability) / 2.0);

        double shortCall = currentPrice + zScore * priceStd;
        double shortPut = currentPrice - zScore * priceStd;
        double longCall = shortCall + wingWidth;
        double longPut = shortPut - wingWidth;

        return StrikeSet.builder()
                .longCall(roundToStrike(longCall))
                .shortCall(roundToStrike(shortCall))
                .shortPut(roundToStrike(shortPut))
                .longPut(roundToStrike(longPut))
                .build();
    }

    static double roundToStrike(double price) {
        return Math.rint(price / STRIKE_INCREMENT) * STRIKE_INCREMENT;
    }
}
