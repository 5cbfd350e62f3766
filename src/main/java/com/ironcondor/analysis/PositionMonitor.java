package com.ironcondor.analysis;

import com.ironcondor.calendar.ExpiryCalendarService;
import com.ironcondor.config.AnalyticsProperties;
import com.ironcondor.domain.enums.AlertSeverity;
import com.ironcondor.domain.enums.AlertType;
import com.ironcondor.domain.model.BatchUpdateResult;
import com.ironcondor.domain.model.MonitorAlert;
import com.ironcondor.domain.model.MonitoredPosition;
import com.ironcondor.domain.model.PositionQuote;
import com.ironcondor.domain.model.PositionStatus;
import com.ironcondor.domain.model.PositionUpdate;
import com.ironcondor.exception.BaseException;
import com.ironcondor.exception.ComputationException;
import com.ironcondor.marketdata.MarketPriceProvider;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recomputes the P&L of open condors against a current price and raises alerts.
 *
 * <p>Expired positions are not rejected: the payoff at expiration is exactly what the
 * position is worth at that point, and the expiration alert still fires.
 */
@Service
public class PositionMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionMonitor.class);

    private final PayoffEvaluator payoffEvaluator;
    private final ExpiryCalendarService expiryCalendarService;
    private final MarketPriceProvider marketPriceProvider;
    private final AnalyticsProperties analyticsProperties;
    private final Clock clock;

    public PositionMonitor(
            PayoffEvaluator payoffEvaluator,
            ExpiryCalendarService expiryCalendarService,
            MarketPriceProvider marketPriceProvider,
            AnalyticsProperties analyticsProperties,
            Clock clock) {
        this.payoffEvaluator = payoffEvaluator;
        this.expiryCalendarService = expiryCalendarService;
        this.marketPriceProvider = marketPriceProvider;
        this.analyticsProperties = analyticsProperties;
        this.clock = clock;
    }

    public PositionStatus monitor(MonitoredPosition position) {
        try {
            return evaluate(position);
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComputationException("Monitoring", e);
        }
    }

    /**
     * Resolves a current price for every quoted position. Market data wins, then the
     * position's own entry price, then the configured fallback.
     */
    public BatchUpdateResult batchUpdate(List<PositionQuote> positions, Map<String, Double> marketData) {
        Instant now = clock.instant();
        List<PositionUpdate> updates = new ArrayList<>(positions.size());
        for (PositionQuote quote : positions) {
            Double price = marketData != null && quote.getSymbol() != null ? marketData.get(quote.getSymbol()) : null;
            if (price == null) {
                price = quote.getEntryPrice() != null
                        ? quote.getEntryPrice()
                        : analyticsProperties.getMarketData().getFallbackPrice();
            }
            updates.add(new PositionUpdate(quote.getPositionId(), quote.getSymbol(), price, now));
        }
        log.info("Batch updated {} positions", updates.size());
        return new BatchUpdateResult(updates, updates.size());
    }

    private PositionStatus evaluate(MonitoredPosition position) {
        AnalyticsProperties.Monitor thresholds = analyticsProperties.getMonitor();

        long days = expiryCalendarService.daysToExpiration(position.getExpirationDate());
        double currentPrice = position.getCurrentPrice() != null
                ? position.getCurrentPrice()
                : marketPriceProvider.currentPrice(position.getSymbol());

        double entryCredit = position.getEntryCredit();
        double pnl = payoffEvaluator.pnlAt(currentPrice, position.getStrikes(), entryCredit, position.getContracts());
        double pnlPercent = entryCredit != 0 ? pnl / Math.abs(entryCredit) * 100.0 : 0.0;

        List<MonitorAlert> alerts = new ArrayList<>();
        if (pnlPercent >= thresholds.getProfitTargetPercent()) {
            alerts.add(new MonitorAlert(
                    AlertType.PROFIT_TARGET,
                    String.format(Locale.ROOT, "Position has reached %.1f%% of max profit", pnlPercent),
                    AlertSeverity.INFO));
        }
        if (pnl < -entryCredit * thresholds.getLossThresholdFraction()) {
            double lostPercent = entryCredit != 0 ? Math.abs(pnl / entryCredit * 100.0) : 0.0;
            alerts.add(new MonitorAlert(
                    AlertType.LOSS_THRESHOLD,
                    String.format(Locale.ROOT, "Position has lost %.1f%% of max profit", lostPercent),
                    AlertSeverity.WARNING));
        }
        if (days <= thresholds.getExpirationWarningDays()) {
            alerts.add(new MonitorAlert(
                    AlertType.EXPIRATION_WARNING,
                    "Position expires in " + days + " days",
                    AlertSeverity.INFO));
        }

        log.info(
                "Monitored strategy {} at {}: pnl={}, alerts={}",
                position.getStrategyId(),
                currentPrice,
                pnl,
                alerts.size());

        return PositionStatus.builder()
                .strategyId(position.getStrategyId())
                .currentPrice(currentPrice)
                .currentPnl(Rounding.money(pnl))
                .pnlPercent(Rounding.money(pnlPercent))
                .daysToExpiration(days)
                .entryCredit(entryCredit)
                .alerts(alerts)
                .build();
    }
}
