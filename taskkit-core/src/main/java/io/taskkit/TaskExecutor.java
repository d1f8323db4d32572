package io.taskkit;

import io.taskkit.core.ExecutorState;

import java.time.Duration;
import java.util.function.BiConsumer;

/**
 * FIFO queue of tasks executed one at a time on a single worker thread ("thread pool of one").
 * Useful to serialize mutations of a shared resource without a caller-side lock.
 */
public interface TaskExecutor {

    /**
     * Options for an executor.
     * <ul>
     *   <li>queueCapacity: max number of tasks waiting to run</li>
     *   <li>submitTimeout: how long {@code submit} waits for room when the backlog is full</li>
     *   <li>pollInterval: how long the idle worker waits before re-checking its state</li>
     * </ul>
     */
    record Options(int queueCapacity, Duration submitTimeout, Duration pollInterval) {
        public static Options defaults() {
            return new Options(100, Duration.ofSeconds(10), Duration.ofMillis(500));
        }
    }

    String name();

    ExecutorState state();

    /**
     * Queue {@code task} for execution. The worker calls {@code runFn} then {@code freeFn}.
     * If the task is rejected, {@code freeFn} (optional) is called right away on the caller's thread.
     *
     * @return false if the executor is not running or its backlog stayed full
     */
    <T, A> boolean submit(T task, A arg, BiConsumer<? super T, ? super A> runFn, BiConsumer<? super T, ? super A> freeFn);

    /**
     * Approximate number of queued tasks; 0 once destroyed.
     */
    int backlogCount();

    /**
     * Drop every queued task that has not started, releasing each through its free function.
     */
    void clear();

    /**
     * Stop the worker and release the queued tasks without running them. Waits for the current
     * task to finish. Safe to call from within a task of this executor.
     */
    void destroy();

    /**
     * Stop accepting tasks and destroy once the whole backlog has run. A task whose submit raced with
     * this call either runs or is rejected and freed; it is never dropped.
     */
    void drainAndDestroy();
}
