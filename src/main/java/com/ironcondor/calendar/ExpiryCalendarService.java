package com.ironcondor.calendar;

import com.ironcondor.exception.InvalidExpirationException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Service;

/**
 * Time-to-expiration arithmetic for the analytics.
 *
 * <p>Days are whole days from now until 00:00 on the expiration date, truncated toward
 * zero. An expiration of tomorrow asked about mid-day is therefore 0 days away and
 * counts as expired. Years are calendar days / 365.
 *
 * <p>"Now" comes from the injected {@link Clock} so the arithmetic is reproducible in tests.
 */
@Service
public class ExpiryCalendarService {

    private static final double DAYS_PER_YEAR = 365.0;

    private final Clock clock;

    public ExpiryCalendarService(Clock clock) {
        this.clock = clock;
    }

    public long daysToExpiration(LocalDate expirationDate) {
        LocalDateTime now = LocalDateTime.now(clock);
        return ChronoUnit.DAYS.between(now, expirationDate.atStartOfDay());
    }

    public double yearsToExpiration(long daysToExpiration) {
        return daysToExpiration / DAYS_PER_YEAR;
    }

    /**
     * Returns the days to expiration, rejecting dates that are not strictly in the future.
     *
     * @throws InvalidExpirationException if fewer than one whole day remains
     */
    public long requireFutureExpiration(LocalDate expirationDate) {
        long days = daysToExpiration(expirationDate);
        if (days <= 0) {
            throw new InvalidExpirationException(expirationDate, days);
        }
        return days;
    }
}
