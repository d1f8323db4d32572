package io.taskkit;

import io.taskkit.core.CancelResult;
import io.taskkit.core.DelayUnit;
import io.taskkit.core.TaskHandles;

import java.util.List;

/**
 * Runs a callback once, on a background thread, after a delay.
 *
 * <p>Every schedule call returns a handle rather than the task itself: the task is released by
 * its own thread once it fired or was canceled, after which the handle simply stops matching.
 *
 * <pre>{@code
 * long handle = scheduler.scheduleDelay(30, DelayUnit.SECONDS, this::expire, session);
 * ...
 * CancelResult result = scheduler.cancel(handle);
 * if (result.canceled()) {
 *     release(result.argument(Session.class));
 * }
 * }</pre>
 */
public interface DelayedTaskScheduler {

    /**
     * Schedule {@code callback} to run once after {@code amount} {@code unit}s.
     *
     * @return a positive handle, or {@link TaskHandles#INVALID} if the task could not be started
     */
    <T> long scheduleDelay(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg);

    /**
     * Schedule {@code callback} to run at the next occurrence of {@code hour:minute}.
     * A target less than a minute away is pushed to the following day.
     */
    <T> long scheduleAtTimeOfDay(int hour, int minute, TaskCallback<? super T> callback, T arg);

    /**
     * Replace the delay of a waiting task; the new delay counts from now.
     *
     * @return false if the task is unknown, running or canceled
     */
    boolean reschedule(long handle, long amount, DelayUnit unit);

    /**
     * True while the task has not fired nor been canceled.
     */
    boolean isWaiting(long handle);

    /**
     * Cancel a waiting task. The callback will never run and the original argument is handed back.
     */
    CancelResult cancel(long handle);

    /**
     * Run a waiting task now instead of at the end of its delay.
     *
     * @return true if the task was still waiting and will run
     */
    boolean forceExecute(long handle);

    /**
     * Number of tasks registered and not yet removed by their worker.
     */
    int pendingCount();

    /**
     * Force every waiting task to run now and wait for all task threads to finish.
     * New tasks are rejected while this runs.
     *
     * @return number of tasks that were forced
     */
    int finalizeAll();

    /**
     * Permanently stop accepting tasks and cancel the waiting ones.
     *
     * @return arguments of the tasks that were canceled
     */
    List<Object> shutdown();
}
