package com.ironcondor.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties under the {@code iron-condor} prefix.
 *
 * <ul>
 *   <li>{@code defaults} -- values applied when a request omits volatility, rate,
 *       target probability or wing width</li>
 *   <li>{@code monitor} -- alert thresholds for position monitoring</li>
 *   <li>{@code marketData} -- reference prices served by the market price collaborator</li>
 *   <li>{@code cors} -- allowed origin pattern for the REST API</li>
 * </ul>
 *
 * <p>Constants that the analysis output is calibrated against (contract multiplier,
 * recommendation target, payoff sampling) are not configurable.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "iron-condor")
public class AnalyticsProperties {

    private Defaults defaults = new Defaults();
    private Monitor monitor = new Monitor();
    private MarketData marketData = new MarketData();
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Defaults {

        /** Implied volatility as a decimal (0.20 = 20%). */
        private double impliedVolatility = 0.20;

        private double riskFreeRate = 0.05;

        private double targetProbability = 0.70;

        private double wingWidth = 5.0;
    }

    @Getter
    @Setter
    public static class Monitor {

        /** P&L as a percent of entry credit at which PROFIT_TARGET fires. */
        private double profitTargetPercent = 50.0;

        /** Loss, as a fraction of entry credit, past which LOSS_THRESHOLD fires. */
        private double lossThresholdFraction = 0.5;

        private int expirationWarningDays = 7;
    }

    @Getter
    @Setter
    public static class MarketData {

        private Map<String, Double> referencePrices = new LinkedHashMap<>();

        /** Used for symbols with no reference price. */
        private double fallbackPrice = 4500.0;
    }

    @Getter
    @Setter
    public static class Cors {

        private String allowedOrigin = "*";
    }
}
