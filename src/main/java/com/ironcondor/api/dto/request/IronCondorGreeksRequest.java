package com.ironcondor.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import lombok.Data;

/**
 * Per-share Greeks of each leg, keyed by {@code delta}, {@code gamma}, {@code theta}
 * and {@code vega}. Missing legs or keys count as zero.
 */
@Data
public class IronCondorGreeksRequest {

    private Map<String, Double> longCall;
    private Map<String, Double> shortCall;
    private Map<String, Double> shortPut;
    private Map<String, Double> longPut;

    @NotNull
    @Positive
    private Integer contracts = 1;
}
