package com.ironcondor.exception;

import java.time.LocalDate;
import java.util.Map;

/**
 * Raised when an expiration date is today or already in the past. Any flow that
 * needs time value (pricing, probability, scoring) cannot proceed, so the whole
 * request is rejected without a partial report.
 */
public class InvalidExpirationException extends BaseException {

    public InvalidExpirationException(LocalDate expirationDate, long daysToExpiration) {
        super(
                ErrorCode.INVALID_EXPIRATION,
                "Expiration date must be in the future",
                Map.of("expirationDate", String.valueOf(expirationDate), "daysToExpiration", daysToExpiration));
    }
}
