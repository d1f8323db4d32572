package io.taskkit.core;

import java.util.concurrent.TimeUnit;

/**
 * Unit applied to a delay amount when scheduling or changing a task.
 */
public enum DelayUnit {

    HOURS(TimeUnit.HOURS),
    MINUTES(TimeUnit.MINUTES),
    SECONDS(TimeUnit.SECONDS),
    MILLIS(TimeUnit.MILLISECONDS);

    private final TimeUnit timeUnit;

    DelayUnit(TimeUnit timeUnit) {
        this.timeUnit = timeUnit;
    }

    /**
     * Converts {@code amount} of this unit to nanoseconds, saturating at {@link Long#MAX_VALUE}.
     */
    public long toNanos(long amount) {
        return timeUnit.toNanos(amount);
    }
}
