package io.taskkit.core;

public enum RepeatMode {
    /** Pause measured from the end of one run to the start of the next. */
    FIXED_DELAY,
    /** Pause measured from the start of one run to the start of the next. */
    FIXED_RATE,
    /** Growing pause, stops once the run callback reports success. */
    BACK_OFF
}
