package com.ironcondor.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * An open condor being watched. {@code entryCredit} is the total credit received,
 * already scaled by contracts x 100.
 */
@Value
@Builder
public class MonitoredPosition {

    long strategyId;
    String symbol;
    LocalDate expirationDate;
    StrikeSet strikes;
    int contracts;
    double entryCredit;

    /** Optional; when absent the market price collaborator is asked. */
    Double currentPrice;
}
