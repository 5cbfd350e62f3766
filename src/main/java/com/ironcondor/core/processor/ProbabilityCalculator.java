package com.ironcondor.core.processor;

import com.ironcondor.domain.enums.OptionType;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Expiration probabilities for a single leg and for a price band.
 *
 * <p>In-the-money probability uses the drift-free d2 = [ln(S/K) - sigma^2 * T / 2] / (sigma * sqrt(T)):
 * calls finish ITM with 1 - N(d2), puts with N(d2).
 *
 * <p>Band probability approximates the terminal price as normal with standard deviation
 * S * sigma * sqrt(T) and returns N(zUpper) - N(zLower). Downstream scoring is calibrated
 * against this approximation, so it must not be replaced with exact log-normal quantiles.
 *
 * <p>All results are fractions in [0, 1]. Stateless and thread-safe.
 */
@Component
public class ProbabilityCalculator {

    public static final String METHOD = "black_scholes_normal_distribution";

    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * Probability that an option finishes in the money.
     * With T &lt;= 0 or sigma &lt;= 0 the answer is 1.0 or 0.0 depending on whether S is
     * already past K.
     */
    public double probabilityItm(double S, double K, double T, double sigma, OptionType type) {
        if (T <= 0 || sigma <= 0) {
            boolean itm = type == OptionType.CALL ? S > K : S < K;
            return itm ? 1.0 : 0.0;
        }

        double d2 = (Math.log(S / K) - 0.5 * sigma * sigma * T) / (sigma * Math.sqrt(T));

        return type == OptionType.CALL ? 1.0 - NORM.cumulativeProbability(d2) : NORM.cumulativeProbability(d2);
    }

    /**
     * Probability that the underlying lands strictly between {@code lower} and {@code upper}
     * at expiration. With T &lt;= 0 or sigma &lt;= 0 the band either already contains S or it
     * does not.
     */
    public double probabilityBetween(double S, double lower, double upper, double T, double sigma) {
        if (T <= 0 || sigma <= 0) {
            return S > lower && S < upper ? 1.0 : 0.0;
        }

        double priceStd = S * sigma * Math.sqrt(T);
        double zUpper = (upper - S) / priceStd;
        double zLower = (lower - S) / priceStd;

        return NORM.cumulativeProbability(zUpper) - NORM.cumulativeProbability(zLower);
    }
}
