package com.ironcondor.analysis;

import com.ironcondor.calendar.ExpiryCalendarService;
import com.ironcondor.core.processor.BlackScholesPricer;
import com.ironcondor.core.processor.ProbabilityCalculator;
import com.ironcondor.domain.enums.OptionType;
import com.ironcondor.domain.model.IronCondorAnalysis;
import com.ironcondor.domain.model.OptimizationCriteria;
import com.ironcondor.domain.model.OptimizationResult;
import com.ironcondor.domain.model.PayoffPoint;
import com.ironcondor.domain.model.QualityMetrics;
import com.ironcondor.domain.model.StrategyParameters;
import com.ironcondor.domain.model.StrikeSet;
import com.ironcondor.exception.BaseException;
import com.ironcondor.exception.ComputationException;
import com.ironcondor.exception.InvalidStrategyException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-pass analysis of an iron condor.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Reject expirations that are not in the future
 *   <li>Price all four legs with Black-Scholes
 *   <li>Net credit = (shortCall - longCall + shortPut - longPut) * contracts * 100
 *   <li>Max profit = net credit; max loss = widest spread * contracts * 100 - net credit
 *   <li>Breakevens = short strikes +/- credit per share
 *   <li>Return on risk = maxProfit / maxLoss * 100, or 0 when max loss is not positive
 *   <li>Probability of profit between the breakevens, short-leg ITM probabilities
 *   <li>Recommended strikes for a 70% probability of profit
 *   <li>Quality score and rating
 *   <li>Payoff curve, 20 points across [0.85 * S, 1.15 * S]
 * </ol>
 *
 * <p>Nothing is cached between calls. Any unexpected runtime failure inside the
 * pipeline is reported as a {@link ComputationException}.
 */
@Service
public class IronCondorAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(IronCondorAnalyzer.class);

    static final double RECOMMENDATION_TARGET_PROBABILITY = 0.70;
    static final int PAYOFF_SAMPLES = 20;
    static final double PAYOFF_RANGE_LOW = 0.85;
    static final double PAYOFF_RANGE_HIGH = 1.15;

    private final BlackScholesPricer blackScholesPricer;
    private final ProbabilityCalculator probabilityCalculator;
    private final PayoffEvaluator payoffEvaluator;
    private final StrikeOptimizer strikeOptimizer;
    private final StrategyScorer strategyScorer;
    private final ExpiryCalendarService expiryCalendarService;

    public IronCondorAnalyzer(
            BlackScholesPricer blackScholesPricer,
            ProbabilityCalculator probabilityCalculator,
            PayoffEvaluator payoffEvaluator,
            StrikeOptimizer strikeOptimizer,
            StrategyScorer strategyScorer,
            ExpiryCalendarService expiryCalendarService) {
        this.blackScholesPricer = blackScholesPricer;
        this.probabilityCalculator = probabilityCalculator;
        this.payoffEvaluator = payoffEvaluator;
        this.strikeOptimizer = strikeOptimizer;
        this.strategyScorer = strategyScorer;
        this.expiryCalendarService = expiryCalendarService;
    }

    /**
     * Analyzes a caller-defined condor. Strikes must keep the wings outside the shorts.
     *
     * @throws com.ironcondor.exception.InvalidExpirationException if the expiration is not in the future
     * @throws InvalidStrategyException if the strikes are out of order or the current price is not positive
     */
    public IronCondorAnalysis analyze(StrategyParameters parameters) {
        long days = expiryCalendarService.requireFutureExpiration(parameters.getExpirationDate());
        validateStrikes(parameters);
        return runAnalysis(parameters, days);
    }

    /**
     * Derives strikes for the requested probability of profit and wing width, then
     * analyzes a condor opened at those strikes.
     */
    public OptimizationResult optimizeAndAnalyze(OptimizationCriteria criteria) {
        long days = expiryCalendarService.requireFutureExpiration(criteria.getExpirationDate());
        double years = expiryCalendarService.yearsToExpiration(days);

        StrikeSet optimalStrikes = strikeOptimizer.optimize(
                criteria.getCurrentPrice(),
                years,
                criteria.getImpliedVolatility(),
                criteria.getTargetProbability(),
                criteria.getWingWidth());

        log.info(
                "Optimized strikes for {} (target {}, wing {}): {}",
                criteria.getSymbol(),
                criteria.getTargetProbability(),
                criteria.getWingWidth(),
                optimalStrikes);

        StrategyParameters parameters = StrategyParameters.builder()
                .symbol(criteria.getSymbol())
                .expirationDate(criteria.getExpirationDate())
                .longCallStrike(optimalStrikes.getLongCall())
                .shortCallStrike(optimalStrikes.getShortCall())
                .shortPutStrike(optimalStrikes.getShortPut())
                .longPutStrike(optimalStrikes.getLongPut())
                .contracts(criteria.getContracts())
                .currentPrice(criteria.getCurrentPrice())
                .impliedVolatility(criteria.getImpliedVolatility())
                .riskFreeRate(criteria.getRiskFreeRate())
                .build();

        // Rounding to the strike grid can collapse a narrow wing, so no ordering check here
        IronCondorAnalysis analysis = runAnalysis(parameters, days);

        return OptimizationResult.builder()
                .optimalStrikes(optimalStrikes)
                .expectedPerformance(analysis)
                .optimizationParameters(OptimizationResult.Parameters.builder()
                        .targetProbability(criteria.getTargetProbability())
                        .wingWidth(criteria.getWingWidth())
                        .currentPrice(criteria.getCurrentPrice())
                        .impliedVolatility(criteria.getImpliedVolatility())
                        .daysToExpiration(days)
                        .build())
                .build();
    }

    private IronCondorAnalysis runAnalysis(StrategyParameters parameters, long days) {
        try {
            IronCondorAnalysis analysis = computeAnalysis(parameters, days);
            log.info(
                    "Analyzed iron condor {} ({} DTE): credit={}, PoP={}%, score={}",
                    parameters.getSymbol(),
                    days,
                    analysis.getRiskReward().getNetCredit(),
                    analysis.getProbability().getProfitPercent(),
                    analysis.getQualityMetrics().getScore());
            return analysis;
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException("Analysis", e);
        }
    }

    private IronCondorAnalysis computeAnalysis(StrategyParameters parameters, long days) {
        double years = expiryCalendarService.yearsToExpiration(days);
        double spot = parameters.effectiveCurrentPrice();
        double r = parameters.getRiskFreeRate();
        double sigma = parameters.getImpliedVolatility();
        int contracts = parameters.getContracts();
        StrikeSet strikes = parameters.strikes();

        // Leg prices
        double longCallPrice = blackScholesPricer.callPrice(spot, strikes.getLongCall(), years, r, sigma);
        double shortCallPrice = blackScholesPricer.callPrice(spot, strikes.getShortCall(), years, r, sigma);
        double shortPutPrice = blackScholesPricer.putPrice(spot, strikes.getShortPut(), years, r, sigma);
        double longPutPrice = blackScholesPricer.putPrice(spot, strikes.getLongPut(), years, r, sigma);

        double shares = contracts * (double) PayoffEvaluator.SHARES_PER_CONTRACT;
        double netCredit = ((shortCallPrice - longCallPrice) + (shortPutPrice - longPutPrice)) * shares;

        // Risk / reward
        double maxProfit = netCredit;
        double maxLoss = strikes.maxSpreadWidth() * shares - netCredit;
        double returnOnRisk = maxLoss > 0 ? maxProfit / maxLoss * 100.0 : 0.0;
        double riskRewardRatio = maxLoss > 0 ? maxProfit / maxLoss : 0.0;

        // Breakevens
        double creditPerShare = netCredit / shares;
        double upperBreakeven = strikes.getShortCall() + creditPerShare;
        double lowerBreakeven = strikes.getShortPut() - creditPerShare;

        log.debug(
                "Leg prices LC={} SC={} SP={} LP={}, breakevens [{}, {}]",
                longCallPrice,
                shortCallPrice,
                shortPutPrice,
                longPutPrice,
                lowerBreakeven,
                upperBreakeven);

        // Probabilities (percent)
        double probabilityOfProfit =
                probabilityCalculator.probabilityBetween(spot, lowerBreakeven, upperBreakeven, years, sigma) * 100.0;
        double shortCallItm =
                probabilityCalculator.probabilityItm(spot, strikes.getShortCall(), years, sigma, OptionType.CALL)
                        * 100.0;
        double shortPutItm =
                probabilityCalculator.probabilityItm(spot, strikes.getShortPut(), years, sigma, OptionType.PUT) * 100.0;

        StrikeSet recommended = strikeOptimizer.optimize(
                spot, years, sigma, RECOMMENDATION_TARGET_PROBABILITY, strikes.maxSpreadWidth());

        QualityMetrics qualityMetrics = strategyScorer.evaluate(returnOnRisk, probabilityOfProfit, days);

        List<PayoffPoint> payoffProfile = payoffEvaluator.curve(
                strikes, netCredit, contracts, spot * PAYOFF_RANGE_LOW, spot * PAYOFF_RANGE_HIGH, PAYOFF_SAMPLES);

        return IronCondorAnalysis.builder()
                .riskReward(IronCondorAnalysis.RiskReward.builder()
                        .maxProfit(Rounding.money(maxProfit))
                        .maxLoss(Rounding.money(maxLoss))
                        .returnOnRiskPercent(Rounding.money(returnOnRisk))
                        .riskRewardRatio(Rounding.scaled(riskRewardRatio, 3))
                        .netCredit(Rounding.money(netCredit))
                        .build())
                .breakevens(IronCondorAnalysis.Breakevens.builder()
                        .upper(Rounding.money(upperBreakeven))
                        .lower(Rounding.money(lowerBreakeven))
                        .range(Rounding.money(upperBreakeven - lowerBreakeven))
                        .rangePercent(Rounding.money((upperBreakeven - lowerBreakeven) / spot * 100.0))
                        .build())
                .probability(IronCondorAnalysis.ProbabilityAnalysis.builder()
                        .profitPercent(Rounding.money(probabilityOfProfit))
                        .lossPercent(Rounding.money(100.0 - probabilityOfProfit))
                        .shortCallItmPercent(Rounding.money(shortCallItm))
                        .shortPutItmPercent(Rounding.money(shortPutItm))
                        .method(ProbabilityCalculator.METHOD)
                        .build())
                .sensitivity(IronCondorAnalysis.Sensitivity.builder()
                        .upsideRoomPercent(Rounding.money((upperBreakeven - spot) / spot * 100.0))
                        .downsideRoomPercent(Rounding.money((spot - lowerBreakeven) / spot * 100.0))
                        .daysToExpiration(days)
                        .impliedVolatility(sigma)
                        .currentPrice(spot)
                        .build())
                .recommendations(IronCondorAnalysis.Recommendations.builder()
                        .optimalStrikes(recommended)
                        .reasoning(String.format(
                                Locale.ROOT,
                                "Strikes optimized for ~%d%% probability of profit based on %.0f%% IV",
                                Math.round(RECOMMENDATION_TARGET_PROBABILITY * 100), sigma * 100.0))
                        .build())
                .qualityMetrics(qualityMetrics)
                .payoffProfile(payoffProfile)
                .build();
    }

    private static void validateStrikes(StrategyParameters parameters) {
        StrikeSet strikes = parameters.strikes();
        if (!strikes.hasWingsOutsideShorts()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("longCallStrike", strikes.getLongCall());
            details.put("shortCallStrike", strikes.getShortCall());
            details.put("shortPutStrike", strikes.getShortPut());
            details.put("longPutStrike", strikes.getLongPut());
            throw new InvalidStrategyException(
                    "Strikes must satisfy longCall > shortCall >= shortPut > longPut", details);
        }
        if (parameters.getCurrentPrice() != null && parameters.getCurrentPrice() <= 0) {
            throw new InvalidStrategyException(
                    "Current price must be positive", Map.of("currentPrice", parameters.getCurrentPrice()));
        }
    }
}
