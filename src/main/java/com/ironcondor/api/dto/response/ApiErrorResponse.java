package com.ironcondor.api.dto.response;

import com.ironcondor.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure envelope {@code {success: false, error: {code, message, details, timestamp, path}}}.
 * The code comes from {@link ErrorCode}, e.g. INVALID_EXPIRATION for an expiration that is
 * not in the future or COMPUTATION_FAILED for an analysis that broke mid-way.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    /** Field-level validation messages and rejected strikes go in {@code details}. */
    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
