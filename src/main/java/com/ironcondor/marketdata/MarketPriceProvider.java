package com.ironcondor.marketdata;

/**
 * Source of the current underlying price for a symbol. The analytics never fetch
 * prices themselves; flows that need one without the caller supplying it ask this.
 */
public interface MarketPriceProvider {

    double currentPrice(String symbol);
}
