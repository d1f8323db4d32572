package io.taskkit;

import java.util.Optional;

/**
 * Entry point to background work: delayed tasks, repeating tasks, serial executors and thread pools.
 *
 * <p>A kit owns one delayed-task registry, one repeating-task registry and every executor and pool
 * it created. {@link #stop()} shuts all of them down.
 *
 * <p>Typical usage:
 * <pre>{@code
 * taskKit.start();
 *
 * taskKit.delayedTasks().scheduleDelay(5, DelayUnit.SECONDS, this::timeout, request);
 * taskKit.repeatingTasks().createFixedDelay(1, DelayUnit.MINUTES, this::poll, device);
 *
 * TaskExecutor serial = taskKit.createExecutor("zigbee-writes");
 * serial.submit(command, device, Command::send, null);
 *
 * taskKit.createThreadPool("discovery", 1, 4, 30)
 *        .ifPresent(pool -> pool.addTask(this::probe, address, null));
 *
 * taskKit.stop();
 * }</pre>
 */
public interface TaskKit {

    /**
     * Start the kit. Should be idempotent.
     */
    void start();

    /**
     * Cancel every delayed and repeating task and destroy every executor and pool. Should be idempotent.
     */
    void stop();

    boolean isRunning();

    DelayedTaskScheduler delayedTasks();

    RepeatingTaskScheduler repeatingTasks();

    /**
     * Create a serial executor using the configured default options.
     */
    TaskExecutor createExecutor(String name);

    TaskExecutor createExecutor(String name, TaskExecutor.Options options);

    /**
     * Create a thread pool using the configured default queue size and add-task timeout.
     *
     * @return empty if the bounds are invalid
     */
    Optional<ThreadPool> createThreadPool(String name, int minThreads, int maxThreads, long idleTimeoutSeconds);

    Optional<ThreadPool> createThreadPool(String name, int minThreads, int maxThreads, ThreadPool.Options options);
}
