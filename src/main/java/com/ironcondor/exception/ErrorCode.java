package com.ironcondor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_EXPIRATION("INVALID_EXPIRATION", 400),
    NOT_FOUND("NOT_FOUND", 404),
    COMPUTATION_FAILED("COMPUTATION_FAILED", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
