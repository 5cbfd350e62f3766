package com.ironcondor.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Validated inputs for one condor analysis.
 *
 * <p>Volatility is expected in (0, 2] and the rate in [0, 0.20]; range checks happen
 * at the API boundary, the analytics assume them. {@code currentPrice} is optional and
 * falls back to the midpoint of the two short strikes.
 */
@Value
@Builder(toBuilder = true)
public class StrategyParameters {

    /** Opaque label, only echoed in logs. */
    String symbol;

    LocalDate expirationDate;

    double longCallStrike;
    double shortCallStrike;
    double shortPutStrike;
    double longPutStrike;

    int contracts;

    Double currentPrice;

    double impliedVolatility;

    double riskFreeRate;

    public double effectiveCurrentPrice() {
        return currentPrice != null ? currentPrice : (shortCallStrike + shortPutStrike) / 2.0;
    }

    public StrikeSet strikes() {
        return StrikeSet.builder()
                .longCall(longCallStrike)
                .shortCall(shortCallStrike)
                .shortPut(shortPutStrike)
                .longPut(longPutStrike)
                .build();
    }
}
