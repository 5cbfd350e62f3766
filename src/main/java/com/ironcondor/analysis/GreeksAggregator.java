package com.ironcondor.analysis;

import com.ironcondor.calendar.ExpiryCalendarService;
import com.ironcondor.core.processor.BlackScholesPricer;
import com.ironcondor.domain.enums.GammaRisk;
import com.ironcondor.domain.enums.LegRole;
import com.ironcondor.domain.model.Greeks;
import com.ironcondor.domain.model.OptionLeg;
import com.ironcondor.domain.model.PortfolioGreeks;
import com.ironcondor.domain.model.StrategyParameters;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Rolls per-share leg Greeks up to position level.
 *
 * <p>Each leg's vector is multiplied by its direction (short +1, long -1) and by
 * contracts x 100. A condor is typically short gamma and vega and long theta; the
 * risk profile and interpretation spell that out for the trader.
 *
 * <p>Leg vectors normally come from the caller. {@link #aggregateFromParameters(StrategyParameters)}
 * prices the legs itself for callers that only have the strategy definition.
 */
@Service
public class GreeksAggregator {

    /** Below this absolute portfolio delta the position counts as delta-neutral. */
    private static final double DELTA_NEUTRAL_BAND = 5.0;

    private final BlackScholesPricer blackScholesPricer;
    private final ExpiryCalendarService expiryCalendarService;

    public GreeksAggregator(BlackScholesPricer blackScholesPricer, ExpiryCalendarService expiryCalendarService) {
        this.blackScholesPricer = blackScholesPricer;
        this.expiryCalendarService = expiryCalendarService;
    }

    /**
     * Aggregates caller-supplied per-share Greeks. Missing legs count as zero.
     */
    public PortfolioGreeks aggregate(Map<LegRole, Greeks> legGreeks, int contracts) {
        double multiplier = contracts * (double) PayoffEvaluator.SHARES_PER_CONTRACT;

        Map<LegRole, Greeks> breakdown = new EnumMap<>(LegRole.class);
        Greeks portfolio = Greeks.ZERO;
        for (LegRole role : LegRole.values()) {
            Greeks raw = legGreeks.getOrDefault(role, Greeks.ZERO);
            Greeks contribution = raw.scale(role.getPositionType().greeksSign() * multiplier);
            breakdown.put(role, contribution.rounded(4));
            portfolio = portfolio.plus(contribution);
        }

        PortfolioGreeks.RiskProfile riskProfile = PortfolioGreeks.RiskProfile.builder()
                .deltaNeutral(Math.abs(portfolio.getDelta()) < DELTA_NEUTRAL_BAND)
                .positiveTheta(portfolio.getTheta() > 0)
                .negativeVega(portfolio.getVega() < 0)
                .gammaRisk(GammaRisk.of(portfolio.getGamma()))
                .build();

        double movePnl = portfolio.getDelta() * 0.01;
        PortfolioGreeks.DailyEstimates dailyEstimates = PortfolioGreeks.DailyEstimates.builder()
                .thetaDecayPnl(Rounding.money(portfolio.getTheta()))
                .pnlIfUnderlyingUp1Pct(Rounding.money(movePnl))
                .pnlIfUnderlyingDown1Pct(Rounding.money(-movePnl))
                .build();

        return PortfolioGreeks.builder()
                .portfolio(portfolio.rounded(4))
                .legsBreakdown(breakdown)
                .riskProfile(riskProfile)
                .dailyEstimates(dailyEstimates)
                .interpretation(interpret(portfolio, riskProfile))
                .build();
    }

    /**
     * Prices every leg with Black-Scholes at the strategy's expiration and aggregates.
     * An expired strategy yields all-zero Greeks rather than an error.
     */
    public PortfolioGreeks aggregateFromParameters(StrategyParameters parameters) {
        long days = expiryCalendarService.daysToExpiration(parameters.getExpirationDate());
        double years = expiryCalendarService.yearsToExpiration(days);
        double spot = parameters.effectiveCurrentPrice();

        Map<LegRole, Greeks> legGreeks = new EnumMap<>(LegRole.class);
        for (OptionLeg leg : parameters.strikes().legs()) {
            legGreeks.put(
                    leg.getRole(),
                    blackScholesPricer.greeks(
                            leg, spot, years, parameters.getRiskFreeRate(), parameters.getImpliedVolatility()));
        }
        return aggregate(legGreeks, parameters.getContracts());
    }

    private PortfolioGreeks.Interpretation interpret(Greeks portfolio, PortfolioGreeks.RiskProfile riskProfile) {
        return PortfolioGreeks.Interpretation.builder()
                .delta(
                        riskProfile.isDeltaNeutral()
                                ? "Position is delta-neutral"
                                : "Position has directional bias (delta: " + Rounding.money(portfolio.getDelta())
                                        + ")")
                .theta(
                        riskProfile.isPositiveTheta()
                                ? "Position benefits from time decay"
                                : "Position loses value over time")
                .vega(
                        riskProfile.isNegativeVega()
                                ? "Position benefits from decreasing volatility"
                                : "Position benefits from increasing volatility")
                .gamma("Gamma risk is " + riskProfile.getGammaRisk().label())
                .build();
    }
}
