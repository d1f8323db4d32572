package io.taskkit;

import io.taskkit.core.CancelResult;
import io.taskkit.core.DelayUnit;
import io.taskkit.core.TaskHandles;

import java.util.List;

/**
 * Runs a callback over and over on a dedicated background thread, pausing between runs.
 *
 * <p>Helpful for monitor loops. Handles follow the same rules as {@link DelayedTaskScheduler}.
 *
 * <p><b>Warning:</b> do not call {@link #cancel(long)} while holding a lock the callback may also
 * need; cancel waits for an in-flight iteration to finish.
 */
public interface RepeatingTaskScheduler {

    /**
     * Run {@code callback} now, then again {@code amount} {@code unit}s after each run completes.
     *
     * @return a positive handle, or {@link TaskHandles#INVALID} when {@code amount} is zero
     */
    <T> long createFixedDelay(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg);

    /**
     * Run {@code callback} now, then every {@code amount} {@code unit}s measured from the start
     * of the first run.
     */
    <T> long createFixedRate(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg);

    /**
     * Wait {@code initDelay}, run {@code runCallback}; while it returns false, wait a pause that
     * grows by {@code increment} each time (capped at {@code maxDelay}) and run again. Once it
     * returns true the task ends and {@code successCallback} (optional) runs once.
     */
    <T> long createBackOff(long initDelay, long maxDelay, long increment, DelayUnit unit,
                           BackOffCallback<? super T> runCallback,
                           TaskCallback<? super T> successCallback,
                           T arg);

    /**
     * Stop the task and hand back its argument.
     */
    CancelResult cancel(long handle);

    /**
     * Cut the current pause short so the task runs again now.
     *
     * @return false if the task is unknown or canceled
     */
    boolean shortCircuit(long handle);

    /**
     * Change the pause. When {@code changeNow} is true the current pause restarts with the new
     * value; otherwise the new value applies from the next pause.
     *
     * @return false if the task is unknown, canceled or {@code amount} is zero
     */
    boolean changeInterval(long handle, long amount, DelayUnit unit, boolean changeNow);

    boolean isActive(long handle);

    int activeCount();

    /**
     * Cancel every task and stop accepting new ones.
     *
     * @return arguments of the tasks that were canceled
     */
    List<Object> shutdown();
}
