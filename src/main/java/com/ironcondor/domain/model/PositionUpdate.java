package com.ironcondor.domain.model;

import java.time.Instant;
import lombok.Value;

@Value
public class PositionUpdate {

    String positionId;
    String symbol;
    double currentPrice;
    Instant updatedAt;
}
