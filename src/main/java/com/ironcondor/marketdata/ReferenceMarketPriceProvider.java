package com.ironcondor.marketdata;

import com.ironcondor.config.AnalyticsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves the reference prices configured under {@code iron-condor.market-data}.
 * Unknown symbols get the configured fallback price.
 */
@Component
public class ReferenceMarketPriceProvider implements MarketPriceProvider {

    private static final Logger log = LoggerFactory.getLogger(ReferenceMarketPriceProvider.class);

    private final AnalyticsProperties.MarketData marketData;

    public ReferenceMarketPriceProvider(AnalyticsProperties analyticsProperties) {
        this.marketData = analyticsProperties.getMarketData();
    }

    @Override
    public double currentPrice(String symbol) {
        Double price = symbol != null ? marketData.getReferencePrices().get(symbol) : null;
        if (price == null) {
            log.debug("No reference price for {}, using fallback {}", symbol, marketData.getFallbackPrice());
            return marketData.getFallbackPrice();
        }
        return price;
    }
}
