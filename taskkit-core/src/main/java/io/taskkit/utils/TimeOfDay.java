package io.taskkit.utils;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Computes delays to a wall-clock time of day.
 */
public final class TimeOfDay {

    /**
     * Targets this close to now (or in the past) move to the next day.
     */
    public static final Duration MIN_LEAD = Duration.ofSeconds(60);

    private TimeOfDay() {
    }

    /**
     * Delay from now until the next occurrence of {@code hour:minute} in the clock's zone.
     *
     * <p>The current second is kept, so the delay is always a whole number of minutes. If the target
     * is at most {@link #MIN_LEAD} away, tomorrow's occurrence is used instead.
     *
     * @param hour   0-23
     * @param minute 0-59
     */
    public static Duration delayUntil(int hour, int minute, Clock clock) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be between 0 and 23: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be between 0 and 59: " + minute);
        }
        Objects.requireNonNull(clock, "clock must not be null");

        ZonedDateTime now = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        ZonedDateTime candidate = now.withHour(hour).withMinute(minute);

        if (Duration.between(now, candidate).compareTo(MIN_LEAD) <= 0) {
            candidate = candidate.plusDays(1);
        }

        return Duration.between(now, candidate);
    }
}
