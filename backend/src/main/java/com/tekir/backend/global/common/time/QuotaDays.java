package com.tekir.backend.global.common.time;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * UTC calendar-day helpers shared by the enforcer, the status reporter and the HTTP edge.
 */
public final class QuotaDays {

    private QuotaDays() {
    }

    public static LocalDate today(Clock clock) {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    public static OffsetDateTime nextReset(Clock clock) {
        return today(clock).plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC);
    }

    public static Duration untilReset(Clock clock) {
        return Duration.between(clock.instant(), nextReset(clock).toInstant());
    }
}
