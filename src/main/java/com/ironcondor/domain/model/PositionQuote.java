package com.ironcondor.domain.model;

import lombok.Builder;
import lombok.Value;

/** A position reference submitted for a batch price refresh. */
@Value
@Builder
public class PositionQuote {

    String positionId;
    String symbol;

    /** Used as the current price when the market data map has nothing for the symbol. */
    Double entryPrice;
}
