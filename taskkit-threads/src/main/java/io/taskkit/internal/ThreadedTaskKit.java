package io.taskkit.internal;

import io.taskkit.DelayedTaskScheduler;
import io.taskkit.RepeatingTaskScheduler;
import io.taskkit.TaskExecutor;
import io.taskkit.TaskKit;
import io.taskkit.ThreadPool;
import io.taskkit.config.TaskKitProperties;
import io.taskkit.core.ExecutorState;
import io.taskkit.internal.delay.ThreadedDelayedTaskScheduler;
import io.taskkit.internal.executor.SerialTaskExecutor;
import io.taskkit.internal.pool.ElasticThreadPool;
import io.taskkit.internal.repeat.ThreadedRepeatingTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TaskKit} built on plain daemon threads.
 *
 * <p>Both task registries are created on {@link #start()}; executors and pools created through the
 * kit are tracked so {@link #stop()} can tear them down. Calling any factory method before
 * {@code start()} or after {@code stop()} throws {@link IllegalStateException}.
 */
public class ThreadedTaskKit implements TaskKit {
    private static final Logger log = LoggerFactory.getLogger(ThreadedTaskKit.class);

    private final TaskKitProperties props;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final Set<TaskExecutor> executors = ConcurrentHashMap.newKeySet();
    private final Set<ThreadPool> pools = ConcurrentHashMap.newKeySet();

    private volatile ThreadedDelayedTaskScheduler delayedTasks;
    private volatile ThreadedRepeatingTaskScheduler repeatingTasks;

    public ThreadedTaskKit(TaskKitProperties props) {
        this(props, Clock.system(Objects.requireNonNull(props, "props must not be null").resolveZone()));
    }

    public ThreadedTaskKit(TaskKitProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            validate();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("TaskKit starting with executorQueueCapacity={}, executorSubmitTimeout={}, poolMaxQueueSize={}, poolIdleTimeout={}, lockMisusePolicy={}, zone={}",
                props.getExecutorQueueCapacity(),
                props.getExecutorSubmitTimeout(),
                props.getPoolMaxQueueSize(),
                props.getPoolIdleTimeout(),
                props.getLockMisusePolicy(),
                clock.getZone());

        delayedTasks = new ThreadedDelayedTaskScheduler(props.getLockMisusePolicy(), clock);
        repeatingTasks = new ThreadedRepeatingTaskScheduler(props.getLockMisusePolicy());
    }

    private void validate() {
        Objects.requireNonNull(props.getLockMisusePolicy(), "taskkit.lockMisusePolicy must not be null");
        if (props.getExecutorQueueCapacity() <= 0) {
            throw new IllegalArgumentException("taskkit.executorQueueCapacity must be positive");
        }
        requirePositive("taskkit.executorSubmitTimeout", props.getExecutorSubmitTimeout());
        requirePositive("taskkit.executorPollInterval", props.getExecutorPollInterval());
        requirePositive("taskkit.poolIdleTimeout", props.getPoolIdleTimeout());
        Duration addTimeout = Objects.requireNonNull(props.getPoolAddTaskTimeout(), "taskkit.poolAddTaskTimeout must not be null");
        if (addTimeout.isNegative()) {
            throw new IllegalArgumentException("taskkit.poolAddTaskTimeout must not be negative");
        }
        if (props.getPoolMaxQueueSize() < 0 || props.getPoolMaxQueueSize() > ThreadPool.MAX_QUEUE_SIZE) {
            throw new IllegalArgumentException("taskkit.poolMaxQueueSize must be between 0 and " + ThreadPool.MAX_QUEUE_SIZE);
        }
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("TaskKit stopping");

        // repeating tasks first: their callbacks may still schedule delayed work
        List<Object> canceledRepeating = repeatingTasks.shutdown();
        List<Object> canceledDelayed = delayedTasks.shutdown();

        List<TaskExecutor> executorSnapshot = new ArrayList<>(executors);
        executors.clear();
        for (TaskExecutor executor : executorSnapshot) {
            try {
                executor.destroy();
            } catch (RuntimeException e) {
                log.error("Failed to destroy executor {}", executor.name(), e);
            }
        }

        List<ThreadPool> poolSnapshot = new ArrayList<>(pools);
        pools.clear();
        for (ThreadPool pool : poolSnapshot) {
            try {
                pool.destroy();
            } catch (RuntimeException e) {
                log.error("Failed to destroy thread pool {}", pool.name(), e);
            }
        }

        log.info("TaskKit stopped; canceledRepeating={}, canceledDelayed={}, executors={}, pools={}",
                canceledRepeating.size(), canceledDelayed.size(), executorSnapshot.size(), poolSnapshot.size());
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public DelayedTaskScheduler delayedTasks() {
        requireStarted();
        return delayedTasks;
    }

    @Override
    public RepeatingTaskScheduler repeatingTasks() {
        requireStarted();
        return repeatingTasks;
    }

    @Override
    public TaskExecutor createExecutor(String name) {
        return createExecutor(name, props.executorOptions());
    }

    @Override
    public TaskExecutor createExecutor(String name, TaskExecutor.Options options) {
        requireStarted();
        TaskExecutor executor = SerialTaskExecutor.start(name, options);
        executors.removeIf(e -> e.state() == ExecutorState.CANCEL);
        executors.add(executor);
        return executor;
    }

    @Override
    public Optional<ThreadPool> createThreadPool(String name, int minThreads, int maxThreads, long idleTimeoutSeconds) {
        if (idleTimeoutSeconds <= 0) {
            log.warn("Invalid idle timeout for thread pool {}: {}s", name, idleTimeoutSeconds);
            return Optional.empty();
        }
        return createThreadPool(name, minThreads, maxThreads,
                props.poolOptions().withIdleTimeout(Duration.ofSeconds(idleTimeoutSeconds)));
    }

    @Override
    public Optional<ThreadPool> createThreadPool(String name, int minThreads, int maxThreads, ThreadPool.Options options) {
        requireStarted();
        Optional<ThreadPool> pool = ElasticThreadPool.create(name, minThreads, maxThreads, options);
        pools.removeIf(p -> !p.isRunning());
        pool.ifPresent(pools::add);
        return pool;
    }

    private void requireStarted() {
        if (!started.get()) {
            throw new IllegalStateException("TaskKit is not running; call start() first");
        }
    }

    private static void requirePositive(String field, Duration value) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be a positive duration");
        }
    }
}
