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
 * Request to analyze a caller-defined iron condor.
 *
 * <p>Volatility and rate are optional and default from {@code iron-condor.defaults}.
 * Without a current price the midpoint of the short strikes is used.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IronCondorAnalysisRequest {

    @NotBlank
    private String symbol;

    /** ISO date, e.g. 2026-11-20. */
    @NotNull
    private LocalDate expirationDate;

    @NotNull
    @Positive
    private Double longCallStrike;

    @NotNull
    @Positive
    private Double shortCallStrike;

    @NotNull
    @Positive
    private Double shortPutStrike;

    @NotNull
    @Positive
    private Double longPutStrike;

    /** Defaults to 1. */
    @Positive
    @Builder.Default
    private Integer contracts = 1;

    @Positive
    private Double currentPrice;

    /** Decimal volatility in (0, 2]. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("2.0")
    private Double impliedVolatility;

    @DecimalMin("0.0")
    @DecimalMax("0.20")
    private Double riskFreeRate;
}
