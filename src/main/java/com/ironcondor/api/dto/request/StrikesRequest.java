package com.ironcondor.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrikesRequest {

    @NotNull
    @Positive
    private Double longCall;

    @NotNull
    @Positive
    private Double shortCall;

    @NotNull
    @Positive
    private Double shortPut;

    @NotNull
    @Positive
    private Double longPut;
}
