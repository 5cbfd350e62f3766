package com.ironcondor.domain.model;

import com.ironcondor.domain.enums.GammaRisk;
import com.ironcondor.domain.enums.LegRole;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Position-level Greeks of a condor: short legs add, long legs subtract, everything
 * scaled by contracts x 100 shares.
 */
@Value
@Builder
public class PortfolioGreeks {

    /** Net Greeks, rounded to 4 decimals. */
    Greeks portfolio;

    /** Signed, scaled contribution of each leg, rounded to 4 decimals. */
    Map<LegRole, Greeks> legsBreakdown;

    RiskProfile riskProfile;
    DailyEstimates dailyEstimates;
    Interpretation interpretation;

    @Value
    @Builder
    public static class RiskProfile {
        boolean deltaNeutral;
        boolean positiveTheta;
        boolean negativeVega;
        GammaRisk gammaRisk;
    }

    @Value
    @Builder
    public static class DailyEstimates {
        BigDecimal thetaDecayPnl;
        BigDecimal pnlIfUnderlyingUp1Pct;
        BigDecimal pnlIfUnderlyingDown1Pct;
    }

    @Value
    @Builder
    public static class Interpretation {
        String delta;
        String theta;
        String vega;
        String gamma;
    }
}
