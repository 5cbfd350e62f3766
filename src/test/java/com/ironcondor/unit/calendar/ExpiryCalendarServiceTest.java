package com.ironcondor.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ironcondor.calendar.ExpiryCalendarService;
import com.ironcondor.exception.ErrorCode;
import com.ironcondor.exception.InvalidExpirationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExpiryCalendarService with "now" fixed at 2026-01-05 10:00 UTC.
 */
class ExpiryCalendarServiceTest {

    private ExpiryCalendarService expiryCalendarService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
        expiryCalendarService = new ExpiryCalendarService(clock);
    }

    @Nested
    @DisplayName("Days to expiration")
    class Days {

        @Test
        @DisplayName("Counts whole days to midnight of the expiration date")
        void wholeDays() {
            // 2026-01-05 10:00 -> 2026-02-05 00:00 is 30 days 14 hours
            assertThat(expiryCalendarService.daysToExpiration(LocalDate.of(2026, 2, 5))).isEqualTo(30);
        }

        @Test
        @DisplayName("Tomorrow asked mid-day is 0 days away")
        void tomorrowIsZero() {
            assertThat(expiryCalendarService.daysToExpiration(LocalDate.of(2026, 1, 6))).isZero();
        }

        @Test
        @DisplayName("Past dates truncate toward zero")
        void pastDates() {
            assertThat(expiryCalendarService.daysToExpiration(LocalDate.of(2026, 1, 5))).isZero();
            assertThat(expiryCalendarService.daysToExpiration(LocalDate.of(2026, 1, 4))).isEqualTo(-1);
        }

        @Test
        @DisplayName("Years are calendar days over 365")
        void years() {
            assertThat(expiryCalendarService.yearsToExpiration(73)).isCloseTo(0.2, within(1e-12));
            assertThat(expiryCalendarService.yearsToExpiration(365)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Future expiration guard")
    class Guard {

        @Test
        @DisplayName("Returns the day count for a future date")
        void futureDate() {
            assertThat(expiryCalendarService.requireFutureExpiration(LocalDate.of(2026, 1, 7))).isEqualTo(1);
        }

        @Test
        @DisplayName("Rejects a date with less than one whole day left")
        void rejectsZeroDays() {
            assertThatThrownBy(() -> expiryCalendarService.requireFutureExpiration(LocalDate.of(2026, 1, 6)))
                    .isInstanceOf(InvalidExpirationException.class)
                    .satisfies(e -> {
                        InvalidExpirationException ex = (InvalidExpirationException) e;
                        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_EXPIRATION);
                        assertThat(ex.getDetails())
                                .containsEntry("expirationDate", "2026-01-06")
                                .containsEntry("daysToExpiration", 0L);
                    });
        }

        @Test
        @DisplayName("Rejects past dates")
        void rejectsPast() {
            assertThatThrownBy(() -> expiryCalendarService.requireFutureExpiration(LocalDate.of(2025, 6, 1)))
                    .isInstanceOf(InvalidExpirationException.class);
        }
    }
}
