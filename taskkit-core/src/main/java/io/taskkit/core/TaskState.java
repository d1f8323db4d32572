package io.taskkit.core;

/**
 * Lifecycle of a delayed or repeating task.
 *
 * <p>Delayed tasks move {@code IDLE -> WAITING -> RUNNING} and are then removed, or
 * {@code IDLE|WAITING -> CANCELED}. Repeating tasks loop {@code RUNNING -> WAITING} until
 * canceled or, for back-off tasks, until the run callback reports success.
 */
public enum TaskState {
    /** Registered, worker thread not yet waiting. */
    IDLE {
        @Override
        public boolean isCancelable() {
            return true;
        }
    },
    WAITING {
        @Override
        public boolean isCancelable() {
            return true;
        }
    },
    RUNNING {
        @Override
        public boolean isCancelable() {
            return false;
        }
    },
    /** Repeating tasks only: skip the current pause and run again now. */
    SHORT_CIRCUIT {
        @Override
        public boolean isCancelable() {
            return false;
        }
    },
    CANCELED {
        @Override
        public boolean isCancelable() {
            return false;
        }
    };

    /**
     * True while a delayed task can still be canceled, rescheduled or forced.
     */
    public abstract boolean isCancelable();
}
