package com.ironcondor.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Full analysis of one iron condor. Built fresh per call and never stored.
 *
 * <p>Money and percentages are rounded to 2 decimals; the risk/reward ratio to 3.
 */
@Value
@Builder
public class IronCondorAnalysis {

    RiskReward riskReward;
    Breakevens breakevens;
    ProbabilityAnalysis probability;
    Sensitivity sensitivity;
    Recommendations recommendations;
    QualityMetrics qualityMetrics;
    List<PayoffPoint> payoffProfile;

    @Value
    @Builder
    public static class RiskReward {
        BigDecimal maxProfit;
        BigDecimal maxLoss;
        BigDecimal returnOnRiskPercent;
        BigDecimal riskRewardRatio;
        BigDecimal netCredit;
    }

    @Value
    @Builder
    public static class Breakevens {
        BigDecimal upper;
        BigDecimal lower;
        BigDecimal range;
        BigDecimal rangePercent;
    }

    @Value
    @Builder
    public static class ProbabilityAnalysis {
        BigDecimal profitPercent;
        BigDecimal lossPercent;
        BigDecimal shortCallItmPercent;
        BigDecimal shortPutItmPercent;

        /** Normal approximation of the terminal price, not an exact log-normal probability. */
        String method;
    }

    @Value
    @Builder
    public static class Sensitivity {
        BigDecimal upsideRoomPercent;
        BigDecimal downsideRoomPercent;
        long daysToExpiration;
        double impliedVolatility;
        double currentPrice;
    }

    @Value
    @Builder
    public static class Recommendations {
        StrikeSet optimalStrikes;
        String reasoning;
    }
}
