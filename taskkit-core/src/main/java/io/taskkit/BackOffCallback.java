package io.taskkit;

/**
 * Iteration of a back-off repeating task.
 */
@FunctionalInterface
public interface BackOffCallback<T> {

    /**
     * @return true to end the task (success), false to try again after a longer pause
     */
    boolean run(T arg);
}
