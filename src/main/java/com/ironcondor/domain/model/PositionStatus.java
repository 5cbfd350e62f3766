package com.ironcondor.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionStatus {

    long strategyId;
    double currentPrice;
    BigDecimal currentPnl;

    /** Current P&L as a percent of the entry credit. */
    BigDecimal pnlPercent;

    long daysToExpiration;
    double entryCredit;
    List<MonitorAlert> alerts;
}
