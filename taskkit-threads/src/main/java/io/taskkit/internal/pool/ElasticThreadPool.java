package io.taskkit.internal.pool;

import io.taskkit.ThreadPool;
import io.taskkit.concurrent.BoundedBlockingQueue;
import io.taskkit.concurrent.Threads;
import io.taskkit.core.ThreadPoolStats;
import io.taskkit.internal.TaskContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * {@link ThreadPool} that keeps {@code minThreads} workers and grows to {@code maxThreads} on demand.
 *
 * <p>A worker is added when a task is queued and the tasks already queued or running outnumber
 * the workers. Workers past the minimum exit when an idle-timeout pop comes back empty and
 * nothing is outstanding.
 */
public class ElasticThreadPool implements ThreadPool {
    private static final Logger log = LoggerFactory.getLogger(ElasticThreadPool.class);

    private final String name;
    private final int minThreads;
    private final int maxThreads;
    private final Options options;
    private final BoundedBlockingQueue<TaskContainer> queue;
    private final AtomicInteger workerIds = new AtomicInteger();

    // guards everything below
    private final ReentrantLock poolLock = new ReentrantLock();
    private final Set<Thread> workers = new HashSet<>();
    private boolean running = true;
    private int active = 0;
    private int outstanding = 0; // queued plus popped-but-not-yet-active

    private long totalTasksQueued;
    private long totalTasksRan;
    private int maxTasksQueued;
    private int maxConcurrentTasks;

    private ElasticThreadPool(String name, int minThreads, int maxThreads, Options options) {
        this.name = name;
        this.minThreads = minThreads;
        this.maxThreads = maxThreads;
        this.options = options;
        int capacity = options.maxQueueSize() == 0 ? MAX_QUEUE_SIZE : options.maxQueueSize();
        this.queue = new BoundedBlockingQueue<>(capacity);
    }

    /**
     * Create a pool and start its minimum workers.
     *
     * @return empty if the bounds are invalid or the minimum workers could not be started
     */
    public static Optional<ThreadPool> create(String name, int minThreads, int maxThreads, Options options) {
        Objects.requireNonNull(options, "options must not be null");
        String poolName = name == null || name.isBlank() ? "tpool" : name;

        if (minThreads < 0 || maxThreads <= 0 || minThreads > maxThreads || maxThreads > MAX_NUM_THREADS
                || options.maxQueueSize() < 0 || options.maxQueueSize() > MAX_QUEUE_SIZE
                || !isPositive(options.idleTimeout()) || options.addTaskTimeout() == null
                || options.addTaskTimeout().isNegative()) {
            log.warn("Invalid thread pool {}: min={}, max={}, options={}", poolName, minThreads, maxThreads, options);
            return Optional.empty();
        }

        ElasticThreadPool pool = new ElasticThreadPool(poolName, minThreads, maxThreads, options);
        boolean started = true;
        pool.poolLock.lock();
        try {
            for (int i = 0; i < minThreads && started; i++) {
                started = pool.addWorker();
            }
        } finally {
            pool.poolLock.unlock();
        }
        if (!started) {
            pool.destroy();
            return Optional.empty();
        }

        log.debug("Created thread pool {}; min={}, max={}, queue={}", poolName, minThreads, maxThreads, pool.queue.capacity());
        return Optional.of(pool);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isRunning() {
        poolLock.lock();
        try {
            return running;
        } finally {
            poolLock.unlock();
        }
    }

    @Override
    public <T> boolean addTask(Consumer<? super T> task, T arg, Consumer<? super T> argFreeFn) {
        TaskContainer job = TaskContainer.forPool(task, arg, argFreeFn);

        boolean queued = false;
        poolLock.lock();
        try {
            if (running) {
                // bounded wait; workers only need this lock after they already popped
                queued = queue.push(job, options.addTaskTimeout());
            }
            if (queued) {
                outstanding++;
                int backlog = queue.count();
                totalTasksQueued++;
                maxTasksQueued = Math.max(maxTasksQueued, backlog);

                if (workers.size() < maxThreads && active + outstanding > workers.size()) {
                    addWorker();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            poolLock.unlock();
        }

        if (!queued) {
            log.warn("{}: unable to add task; running={}, backlog={}", name, isRunning(), queue.count());
            job.release();
        }
        return queued;
    }

    /**
     * Assumes the pool lock is held.
     */
    private boolean addWorker() {
        Thread thread = Threads.newThread(name + "-w" + workerIds.getAndIncrement(), this::workLoop);
        workers.add(thread);
        if (!Threads.start(thread)) {
            workers.remove(thread);
            return false;
        }
        log.debug("{}: added worker; threads={}, active={}, outstanding={}", name, workers.size(), active, outstanding);
        return true;
    }

    @Override
    public int getActiveCount() {
        poolLock.lock();
        try {
            return running ? active : 0;
        } finally {
            poolLock.unlock();
        }
    }

    @Override
    public int getThreadCount() {
        poolLock.lock();
        try {
            return running ? workers.size() : 0;
        } finally {
            poolLock.unlock();
        }
    }

    @Override
    public int getBacklogCount() {
        return isRunning() ? queue.count() : 0;
    }

    @Override
    public void iterateBacklog(Predicate<Object> visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        if (!isRunning()) {
            return;
        }
        queue.iterate(job -> visitor.test(job.argument()));
    }

    @Override
    public ThreadPoolStats getStatistics(boolean thenClear) {
        poolLock.lock();
        try {
            ThreadPoolStats stats = new ThreadPoolStats(totalTasksQueued, totalTasksRan, maxTasksQueued, maxConcurrentTasks);
            if (thenClear) {
                resetStatistics();
            }
            return stats;
        } finally {
            poolLock.unlock();
        }
    }

    @Override
    public void clearStatistics() {
        poolLock.lock();
        try {
            resetStatistics();
        } finally {
            poolLock.unlock();
        }
    }

    private void resetStatistics() {
        totalTasksQueued = 0;
        totalTasksRan = 0;
        maxTasksQueued = 0;
        maxConcurrentTasks = 0;
    }

    @Override
    public void destroy() {
        List<Thread> snapshot;
        poolLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            snapshot = new ArrayList<>(workers);
        } finally {
            poolLock.unlock();
        }
        log.debug("{}: destroying thread pool; workers={}", name, snapshot.size());

        // wakes every idle worker
        queue.disable();

        for (Thread thread : snapshot) {
            // a task destroying its own pool: that worker exits once the task returns
            if (!Threads.isCurrent(thread)) {
                Threads.joinQuietly(thread);
            }
        }

        int dropped = queue.clear(TaskContainer::release);
        log.info("Thread pool {} destroyed; dropped={}", name, dropped);
    }

    private void workLoop() {
        Thread self = Thread.currentThread();
        boolean keepGoing = true;
        while (keepGoing) {
            TaskContainer job;
            try {
                job = queue.pop(options.idleTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{}: worker {} interrupted; exiting", name, self.getName());
                retire(self);
                return;
            }

            boolean runIt = false;
            poolLock.lock();
            try {
                if (!running) {
                    if (job != null) {
                        outstanding--;
                    }
                    workers.remove(self);
                    keepGoing = false;
                } else if (job != null) {
                    outstanding--;
                    active++;
                    totalTasksRan++;
                    maxConcurrentTasks = Math.max(maxConcurrentTasks, active);
                    runIt = true;
                } else if (workers.size() > minThreads && outstanding == 0) {
                    // removed under the lock so addTask never counts a worker that is leaving
                    workers.remove(self);
                    keepGoing = false;
                    log.debug("{}: removing idle worker; threads={}, min={}", name, workers.size(), minThreads);
                }
            } finally {
                poolLock.unlock();
            }

            if (runIt) {
                execute(job);
                poolLock.lock();
                try {
                    active--;
                } finally {
                    poolLock.unlock();
                }
            } else if (job != null) {
                job.release();
            }
        }
    }

    private void retire(Thread self) {
        poolLock.lock();
        try {
            workers.remove(self);
        } finally {
            poolLock.unlock();
        }
    }

    private void execute(TaskContainer job) {
        try {
            job.runThenRelease();
        } catch (RuntimeException e) {
            log.error("{}: task failed", name, e);
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
