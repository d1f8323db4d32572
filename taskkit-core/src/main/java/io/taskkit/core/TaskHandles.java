package io.taskkit.core;

/**
 * Task handles are positive, monotonically increasing lookup keys. They are never reused
 * within a registry, so a stale handle can only miss, never address a later task.
 */
public final class TaskHandles {

    /**
     * Returned when a task could not be scheduled.
     */
    public static final long INVALID = 0L;

    private TaskHandles() {
    }

    public static boolean isValid(long handle) {
        return handle > INVALID;
    }
}
