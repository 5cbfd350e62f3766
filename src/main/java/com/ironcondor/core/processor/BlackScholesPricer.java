package com.ironcondor.core.processor;

import com.ironcondor.domain.enums.OptionType;
import com.ironcondor.domain.model.Greeks;
import com.ironcondor.domain.model.OptionLeg;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes price and Greeks for a single European call or put (no dividends).
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * N(-d1)
 *   <li>Delta: N(d1) for calls, N(d1) - 1 for puts
 *   <li>Gamma: n(d1) / (S * sigma * sqrt(T))
 *   <li>Theta: per calendar day (divided by 365)
 *   <li>Vega: S * n(d1) * sqrt(T) / 100 (per 1 vol-point)
 * </ul>
 *
 * <p>At or after expiry (T &lt;= 0), or with no volatility (sigma &lt;= 0), prices collapse
 * to intrinsic value and every Greek is zero. The rate r is not range-checked.
 *
 * <p>This class is stateless and thread-safe.
 */
@Component
public class BlackScholesPricer {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private static final double DAYS_PER_YEAR = 365.0;

    /**
     * Theoretical price of a European option.
     *
     * @param S     underlying price
     * @param K     strike
     * @param T     time to expiry in years
     * @param r     risk-free rate as a decimal
     * @param sigma volatility as a decimal
     * @param type  CALL or PUT
     */
    public double price(double S, double K, double T, double r, double sigma, OptionType type) {
        return type == OptionType.CALL ? callPrice(S, K, T, r, sigma) : putPrice(S, K, T, r, sigma);
    }

    public double price(OptionLeg leg, double S, double T, double r, double sigma) {
        return price(S, leg.getStrike(), T, r, sigma, leg.getOptionType());
    }

    public double callPrice(double S, double K, double T, double r, double sigma) {
        if (isDegenerate(T, sigma)) {
            return Math.max(0.0, S - K);
        }
        double d1 = d1(S, K, T, r, sigma);
        double d2 = d1 - sigma * Math.sqrt(T);
        return S * NORM.cumulativeProbability(d1) - K * Math.exp(-r * T) * NORM.cumulativeProbability(d2);
    }

    public double putPrice(double S, double K, double T, double r, double sigma) {
        if (isDegenerate(T, sigma)) {
            return Math.max(0.0, K - S);
        }
        double d1 = d1(S, K, T, r, sigma);
        double d2 = d1 - sigma * Math.sqrt(T);
        return K * Math.exp(-r * T) * NORM.cumulativeProbability(-d2) - S * NORM.cumulativeProbability(-d1);
    }

    /**
     * Per-share Greeks with the raw model sign. Long/short direction is not applied here.
     */
    public Greeks greeks(double S, double K, double T, double r, double sigma, OptionType type) {
        if (isDegenerate(T, sigma)) {
            return Greeks.ZERO;
        }

        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, sigma);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = NORM.density(d1); // PDF at d1
        double Nd1 = NORM.cumulativeProbability(d1); // CDF at d1
        double expRT = Math.exp(-r * T);
        double timeDecay = -S * nd1 * sigma / (2.0 * sqrtT);

        double delta;
        double theta;
        if (type == OptionType.CALL) {
            delta = Nd1;
            theta = (timeDecay - r * K * expRT * NORM.cumulativeProbability(d2)) / DAYS_PER_YEAR;
        } else {
            delta = Nd1 - 1.0;
            theta = (timeDecay + r * K * expRT * NORM.cumulativeProbability(-d2)) / DAYS_PER_YEAR;
        }

        // Gamma and Vega are the same for calls and puts
        double gamma = nd1 / (S * sigma * sqrtT);
        double vega = S * nd1 * sqrtT / 100.0;

        return Greeks.builder().delta(delta).gamma(gamma).theta(theta).vega(vega).build();
    }

    public Greeks greeks(OptionLeg leg, double S, double T, double r, double sigma) {
        return greeks(S, leg.getStrike(), T, r, sigma, leg.getOptionType());
    }

    private static boolean isDegenerate(double T, double sigma) {
        return T <= 0 || sigma <= 0;
    }

    private static double d1(double S, double K, double T, double r, double sigma) {
        return (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * Math.sqrt(T));
    }
}
