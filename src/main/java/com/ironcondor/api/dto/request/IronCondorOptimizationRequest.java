package com.ironcondor.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
 * Request to derive strikes for a target probability of profit and analyze the result.
 * Target probability and wing width default from {@code iron-condor.defaults}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IronCondorOptimizationRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private LocalDate expirationDate;

    @NotNull
    @Positive
    private Double currentPrice;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("2.0")
    private Double impliedVolatility;

    @DecimalMin("0.5")
    @DecimalMax("0.95")
    private Double targetProbability;

    @Positive
    private Double wingWidth;

    /** Defaults to 1. */
    @Positive
    @Builder.Default
    private Integer contracts = 1;
}
