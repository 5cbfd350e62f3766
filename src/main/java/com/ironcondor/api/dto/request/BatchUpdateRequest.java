package com.ironcondor.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Positions to refresh plus the latest prices, keyed by symbol. */
@Data
public class BatchUpdateRequest {

    @NotNull
    @Valid
    private List<PositionRef> positions = new ArrayList<>();

    private Map<String, Double> marketData = new HashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionRef {

        private String id;

        private String symbol;

        /** Price to report when market data has nothing for the symbol. */
        private Double entryPrice;
    }
}
