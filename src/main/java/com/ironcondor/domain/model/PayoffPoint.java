package com.ironcondor.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** One sample of the expiration payoff curve. */
@Value
public class PayoffPoint {

    BigDecimal price;
    BigDecimal pnl;
}
