package com.ironcondor.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request to re-evaluate an open condor.
 *
 * <p>{@code entryCredit} is the total credit received for the position, already
 * scaled by contracts. When {@code currentPrice} is omitted the configured market
 * price source is consulted.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionMonitorRequest {

    @NotNull
    private Long strategyId;

    @NotBlank
    private String symbol;

    @NotNull
    private LocalDate expirationDate;

    @NotNull
    @Valid
    private StrikesRequest strikes;

    @NotNull
    @Positive
    private Integer contracts;

    @NotNull
    private Double entryCredit;

    @Positive
    private Double currentPrice;
}
