package io.taskkit.config;

import java.time.Duration;
import java.time.ZoneId;

import io.taskkit.TaskExecutor;
import io.taskkit.ThreadPool;
import io.taskkit.concurrent.LockMisusePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for TaskKit executors, pools and task locks.
 */
@ConfigurationProperties(prefix = "taskkit")
public class TaskKitProperties {
    private int executorQueueCapacity = 100;
    private Duration executorSubmitTimeout = Duration.ofSeconds(10);
    private Duration executorPollInterval = Duration.ofMillis(500);
    private int poolMaxQueueSize = ThreadPool.MAX_QUEUE_SIZE;
    private Duration poolAddTaskTimeout = Duration.ofMillis(10);
    private Duration poolIdleTimeout = Duration.ofSeconds(10);
    private LockMisusePolicy lockMisusePolicy = LockMisusePolicy.RAISE;
    private String timeZone; // IANA id, system default when unset

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public Duration getExecutorSubmitTimeout() {
        return executorSubmitTimeout;
    }

    public void setExecutorSubmitTimeout(Duration executorSubmitTimeout) {
        this.executorSubmitTimeout = executorSubmitTimeout;
    }

    public Duration getExecutorPollInterval() {
        return executorPollInterval;
    }

    public void setExecutorPollInterval(Duration executorPollInterval) {
        this.executorPollInterval = executorPollInterval;
    }

    public int getPoolMaxQueueSize() {
        return poolMaxQueueSize;
    }

    public void setPoolMaxQueueSize(int poolMaxQueueSize) {
        this.poolMaxQueueSize = poolMaxQueueSize;
    }

    public Duration getPoolAddTaskTimeout() {
        return poolAddTaskTimeout;
    }

    public void setPoolAddTaskTimeout(Duration poolAddTaskTimeout) {
        this.poolAddTaskTimeout = poolAddTaskTimeout;
    }

    public Duration getPoolIdleTimeout() {
        return poolIdleTimeout;
    }

    public void setPoolIdleTimeout(Duration poolIdleTimeout) {
        this.poolIdleTimeout = poolIdleTimeout;
    }

    public LockMisusePolicy getLockMisusePolicy() {
        return lockMisusePolicy;
    }

    public void setLockMisusePolicy(LockMisusePolicy lockMisusePolicy) {
        this.lockMisusePolicy = lockMisusePolicy;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    /**
     * Zone used for time-of-day scheduling.
     */
    public ZoneId resolveZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }

    public TaskExecutor.Options executorOptions() {
        return new TaskExecutor.Options(executorQueueCapacity, executorSubmitTimeout, executorPollInterval);
    }

    public ThreadPool.Options poolOptions() {
        return new ThreadPool.Options(poolMaxQueueSize, poolIdleTimeout, poolAddTaskTimeout);
    }
}
