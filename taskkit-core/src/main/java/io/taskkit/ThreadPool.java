package io.taskkit;

import io.taskkit.core.ThreadPoolStats;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Dynamic pool of worker threads sharing a bounded backlog.
 *
 * <p>{@code minThreads} workers are kept alive; the pool grows up to {@code maxThreads} when
 * every worker is busy, and workers past the minimum exit after sitting idle for the idle timeout.
 * Once more than one worker runs, tasks may complete out of submission order.
 */
public interface ThreadPool {

    int MAX_NUM_THREADS = 64;
    int MAX_QUEUE_SIZE = 128;

    /**
     * Options for a pool.
     * <ul>
     *   <li>maxQueueSize: backlog capacity; 0 means {@link #MAX_QUEUE_SIZE}</li>
     *   <li>idleTimeout: how long a worker past the minimum may sit idle</li>
     *   <li>addTaskTimeout: how long {@code addTask} waits for room when the backlog is full</li>
     * </ul>
     */
    record Options(int maxQueueSize, Duration idleTimeout, Duration addTaskTimeout) {
        public static Options defaults() {
            return new Options(MAX_QUEUE_SIZE, Duration.ofSeconds(10), Duration.ofMillis(10));
        }

        public Options withIdleTimeout(Duration idleTimeout) {
            return new Options(maxQueueSize, idleTimeout, addTaskTimeout);
        }
    }

    String name();

    boolean isRunning();

    /**
     * Queue {@code task}; a worker later calls {@code task.accept(arg)} then {@code argFreeFn.accept(arg)}.
     * When rejected, {@code argFreeFn} (optional) is called right away on the caller's thread.
     *
     * @return false if the pool is destroyed or the backlog stayed full
     */
    <T> boolean addTask(Consumer<? super T> task, T arg, Consumer<? super T> argFreeFn);

    /**
     * Number of tasks currently running.
     */
    int getActiveCount();

    /**
     * Number of worker threads alive.
     */
    int getThreadCount();

    /**
     * Number of tasks waiting for a worker.
     */
    int getBacklogCount();

    /**
     * Visit the arguments of queued tasks, oldest first, until {@code visitor} returns false.
     */
    void iterateBacklog(Predicate<Object> visitor);

    /**
     * Copy of the statistics collected so far, optionally resetting them afterwards.
     */
    ThreadPoolStats getStatistics(boolean thenClear);

    void clearStatistics();

    /**
     * Stop every worker once its current task returns and wait for them. Queued tasks are released
     * without running. Safe to call from within a task of this pool.
     */
    void destroy();
}
