package com.ironcondor.analysis;

import com.ironcondor.domain.enums.FactorGrade;
import com.ironcondor.domain.enums.StrategyRating;
import com.ironcondor.domain.model.QualityMetrics;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Turns return-on-risk, probability of profit and days to expiration into a quality
 * score and a rating.
 *
 * <p>Score (0-100) = 0.3 * min(100, ROR * 2) + 0.5 * POP + 0.2 * timeScore, where the
 * time score is 100 inside the 30-45 day window, scales linearly to 0 below it and
 * loses 2 points per day past 45 (floored at 0).
 *
 * <p>Rating uses a separate blend, ROR * 2 * 0.4 + POP * 0.6. The two weightings are
 * kept independent.
 *
 * <p>ROR and POP are percentages (25.0 = 25%).
 */
@Component
public class StrategyScorer {

    private static final int OPTIMAL_MIN_DAYS = 30;
    private static final int OPTIMAL_MAX_DAYS = 45;

    public QualityMetrics evaluate(double returnOnRisk, double probabilityOfProfit, long daysToExpiration) {
        return QualityMetrics.builder()
                .score(score(returnOnRisk, probabilityOfProfit, daysToExpiration))
                .rating(rating(returnOnRisk, probabilityOfProfit))
                .factors(QualityMetrics.Factors.builder()
                        .returnOnRisk(gradeReturnOnRisk(returnOnRisk))
                        .probabilityOfProfit(gradeProbabilityOfProfit(probabilityOfProfit))
                        .timeToExpiration(gradeTimeToExpiration(daysToExpiration))
                        .build())
                .build();
    }

    public double score(double returnOnRisk, double probabilityOfProfit, long daysToExpiration) {
        double rorScore = Math.min(100.0, returnOnRisk * 2); // 50% ROR = 100
        double popScore = probabilityOfProfit;
        double timeScore = timeScore(daysToExpiration);

        double total = rorScore * 0.3 + popScore * 0.5 + timeScore * 0.2;
        return BigDecimal.valueOf(total).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    public StrategyRating rating(double returnOnRisk, double probabilityOfProfit) {
        double blend = returnOnRisk * 2 * 0.4 + probabilityOfProfit * 0.6;
        return StrategyRating.fromBlend(blend);
    }

    double timeScore(long daysToExpiration) {
        if (daysToExpiration >= OPTIMAL_MIN_DAYS && daysToExpiration <= OPTIMAL_MAX_DAYS) {
            return 100.0;
        }
        if (daysToExpiration < OPTIMAL_MIN_DAYS) {
            return Math.max(0.0, daysToExpiration / (double) OPTIMAL_MIN_DAYS * 100.0);
        }
        return Math.max(0.0, 100.0 - (daysToExpiration - OPTIMAL_MAX_DAYS) * 2.0);
    }

    FactorGrade gradeReturnOnRisk(double returnOnRisk) {
        if (returnOnRisk > 20) {
            return FactorGrade.GOOD;
        }
        return returnOnRisk > 10 ? FactorGrade.FAIR : FactorGrade.POOR;
    }

    FactorGrade gradeProbabilityOfProfit(double probabilityOfProfit) {
        if (probabilityOfProfit > 65) {
            return FactorGrade.GOOD;
        }
        return probabilityOfProfit > 50 ? FactorGrade.FAIR : FactorGrade.POOR;
    }

    FactorGrade gradeTimeToExpiration(long daysToExpiration) {
        if (daysToExpiration >= OPTIMAL_MIN_DAYS && daysToExpiration <= OPTIMAL_MAX_DAYS) {
            return FactorGrade.OPTIMAL;
        }
        return daysToExpiration > 20 ? FactorGrade.ACCEPTABLE : FactorGrade.RISKY;
    }
}
