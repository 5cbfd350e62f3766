package com.ironcondor.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Per-share Black-Scholes sensitivities of a single option, with the raw model sign
 * (a long call and a short call carry the same vector). Direction and contract
 * scaling are applied when legs are aggregated.
 *
 * <p>Vega is per 1 vol-point, theta per calendar day.
 */
@Value
@Builder
public class Greeks {

    public static final Greeks ZERO = new Greeks(0.0, 0.0, 0.0, 0.0);

    double delta;
    double gamma;
    double theta;
    double vega;

    /**
     * Reads a loosely-typed Greek map. Missing or null entries count as 0.0
     * rather than failing the aggregation.
     */
    public static Greeks fromMap(Map<String, Double> values) {
        if (values == null) {
            return ZERO;
        }
        return new Greeks(
                valueOrZero(values, "delta"),
                valueOrZero(values, "gamma"),
                valueOrZero(values, "theta"),
                valueOrZero(values, "vega"));
    }

    public Greeks scale(double factor) {
        return new Greeks(delta * factor, gamma * factor, theta * factor, vega * factor);
    }

    public Greeks plus(Greeks other) {
        return new Greeks(delta + other.delta, gamma + other.gamma, theta + other.theta, vega + other.vega);
    }

    public Greeks rounded(int scale) {
        return new Greeks(round(delta, scale), round(gamma, scale), round(theta, scale), round(vega, scale));
    }

    private static double valueOrZero(Map<String, Double> values, String key) {
        Double value = values.get(key);
        return value != null ? value : 0.0;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
