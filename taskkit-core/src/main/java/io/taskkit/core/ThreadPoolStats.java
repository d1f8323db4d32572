package io.taskkit.core;

/**
 * Statistics gathered by a thread pool since creation or the last clear.
 *
 * totalTasksQueued   : number of tasks accepted into the backlog
 * totalTasksRan      : number of tasks a worker picked up
 * maxTasksQueued     : largest backlog observed right after an add
 * maxConcurrentTasks : largest number of tasks running at the same time
 */
public record ThreadPoolStats(
        long totalTasksQueued,
        long totalTasksRan,
        int maxTasksQueued,
        int maxConcurrentTasks
) {

    public static ThreadPoolStats empty() {
        return new ThreadPoolStats(0, 0, 0, 0);
    }
}
