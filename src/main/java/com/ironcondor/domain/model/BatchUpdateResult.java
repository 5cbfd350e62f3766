package com.ironcondor.domain.model;

import java.util.List;
import lombok.Value;

@Value
public class BatchUpdateResult {

    List<PositionUpdate> updates;
    int totalUpdated;
}
