package io.taskkit.internal.delay;

import io.taskkit.DelayedTaskScheduler;
import io.taskkit.TaskCallback;
import io.taskkit.concurrent.LockMisusePolicy;
import io.taskkit.concurrent.Threads;
import io.taskkit.core.CancelResult;
import io.taskkit.core.DelayUnit;
import io.taskkit.core.TaskHandles;
import io.taskkit.utils.TimeOfDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link DelayedTaskScheduler} that gives every task its own worker thread.
 *
 * <p>The registry maps handles to tasks and is only touched to insert, look up or remove; no
 * callback ever runs while it is being modified. Each worker removes its own entry once it
 * fired or was canceled.
 */
public class ThreadedDelayedTaskScheduler implements DelayedTaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ThreadedDelayedTaskScheduler.class);

    private final ConcurrentHashMap<Long, DelayedTask<?>> tasks = new ConcurrentHashMap<>();
    private final AtomicLong handleCounter = new AtomicLong();
    private final LockMisusePolicy lockPolicy;
    private final Clock clock;

    // read side: schedule; write side: finalizeAll / shutdown flip the admission flags
    private final ReentrantReadWriteLock admission = new ReentrantReadWriteLock();
    private boolean finalizing = false;
    private boolean closed = false;

    public ThreadedDelayedTaskScheduler(LockMisusePolicy lockPolicy, Clock clock) {
        this.lockPolicy = Objects.requireNonNull(lockPolicy, "lockPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public <T> long scheduleDelay(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        return register(unit.toNanos(amount), callback, arg);
    }

    @Override
    public <T> long scheduleAtTimeOfDay(int hour, int minute, TaskCallback<? super T> callback, T arg) {
        Objects.requireNonNull(callback, "callback must not be null");
        Duration delay = TimeOfDay.delayUntil(hour, minute, clock);
        log.debug("Scheduling time-of-day task at {}:{} (in {})", hour, minute, delay);
        return register(delay.toNanos(), callback, arg);
    }

    private <T> long register(long delayNanos, TaskCallback<? super T> callback, T arg) {
        DelayedTask<T> task = admit(delayNanos, callback, arg);
        if (task == null) {
            return TaskHandles.INVALID;
        }

        long handle = task.handle();
        Thread worker = Threads.newThread("delayedTask:" + handle, () -> {
            try {
                task.run();
            } finally {
                tasks.remove(handle, task);
            }
        });
        task.attach(worker);

        if (!Threads.start(worker)) {
            tasks.remove(handle, task);
            return TaskHandles.INVALID;
        }

        log.debug("Scheduled delayed task {} in {} ms", handle, Duration.ofNanos(delayNanos).toMillis());
        return handle;
    }

    private <T> DelayedTask<T> admit(long delayNanos, TaskCallback<? super T> callback, T arg) {
        admission.readLock().lock();
        try {
            if (closed || finalizing) {
                log.warn("Rejecting delayed task: scheduler is {}", closed ? "shut down" : "finalizing");
                return null;
            }
            long handle = handleCounter.incrementAndGet();
            DelayedTask<T> task = new DelayedTask<>(handle, delayNanos, callback, arg, lockPolicy);
            tasks.put(handle, task);
            return task;
        } finally {
            admission.readLock().unlock();
        }
    }

    @Override
    public boolean reschedule(long handle, long amount, DelayUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        DelayedTask<?> task = tasks.get(handle);
        return task != null && task.reschedule(unit.toNanos(amount));
    }

    @Override
    public boolean isWaiting(long handle) {
        DelayedTask<?> task = tasks.get(handle);
        return task != null && task.isWaiting();
    }

    @Override
    public CancelResult cancel(long handle) {
        DelayedTask<?> task = tasks.get(handle);
        if (task == null) {
            return CancelResult.notFound();
        }
        CancelResult result = task.cancel();
        if (result.canceled()) {
            log.debug("Canceled delayed task {}", handle);
        }
        return result;
    }

    @Override
    public boolean forceExecute(long handle) {
        DelayedTask<?> task = tasks.get(handle);
        return task != null && task.force();
    }

    @Override
    public int pendingCount() {
        return tasks.size();
    }

    @Override
    public int finalizeAll() {
        admission.writeLock().lock();
        try {
            finalizing = true;
        } finally {
            admission.writeLock().unlock();
        }

        int forced = 0;
        try {
            for (DelayedTask<?> task : new ArrayList<>(tasks.values())) {
                if (task.force()) {
                    forced++;
                }
                Threads.joinQuietly(task.worker());
            }
        } finally {
            admission.writeLock().lock();
            try {
                finalizing = false;
            } finally {
                admission.writeLock().unlock();
            }
        }

        log.info("Finalized {} delayed tasks", forced);
        return forced;
    }

    @Override
    public List<Object> shutdown() {
        admission.writeLock().lock();
        try {
            if (closed) {
                return List.of();
            }
            closed = true;
        } finally {
            admission.writeLock().unlock();
        }

        List<Object> arguments = new ArrayList<>();
        for (DelayedTask<?> task : new ArrayList<>(tasks.values())) {
            CancelResult result = task.cancel();
            if (result.canceled()) {
                arguments.add(result.argument());
            }
        }
        log.info("Delayed task scheduler shut down; canceled={}", arguments.size());
        return arguments;
    }
}
