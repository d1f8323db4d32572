package io.taskkit.internal.repeat;

import io.taskkit.BackOffCallback;
import io.taskkit.RepeatingTaskScheduler;
import io.taskkit.TaskCallback;
import io.taskkit.concurrent.LockMisusePolicy;
import io.taskkit.concurrent.Threads;
import io.taskkit.core.CancelResult;
import io.taskkit.core.DelayUnit;
import io.taskkit.core.RepeatMode;
import io.taskkit.core.TaskHandles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link RepeatingTaskScheduler} with one worker thread per task.
 */
public class ThreadedRepeatingTaskScheduler implements RepeatingTaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ThreadedRepeatingTaskScheduler.class);

    private final ConcurrentHashMap<Long, RepeatingTask<?>> tasks = new ConcurrentHashMap<>();
    private final AtomicLong handleCounter = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final LockMisusePolicy lockPolicy;

    public ThreadedRepeatingTaskScheduler(LockMisusePolicy lockPolicy) {
        this.lockPolicy = Objects.requireNonNull(lockPolicy, "lockPolicy must not be null");
    }

    @Override
    public <T> long createFixedDelay(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg) {
        return createPeriodic(RepeatMode.FIXED_DELAY, amount, unit, callback, arg);
    }

    @Override
    public <T> long createFixedRate(long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg) {
        return createPeriodic(RepeatMode.FIXED_RATE, amount, unit, callback, arg);
    }

    private <T> long createPeriodic(RepeatMode mode, long amount, DelayUnit unit, TaskCallback<? super T> callback, T arg) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(callback, "callback must not be null");
        requireNotNegative("amount", amount);
        if (amount == 0) {
            log.warn("Rejecting {} task with zero delay", mode);
            return TaskHandles.INVALID;
        }

        RepeatingTask.Builder<T> builder = RepeatingTask.<T>builder(handleCounter.incrementAndGet(), mode, lockPolicy)
                .callback(callback)
                .delays(unit.toNanos(amount), 0L, 0L)
                .argument(arg);
        return launch(builder.build());
    }

    @Override
    public <T> long createBackOff(long initDelay, long maxDelay, long increment, DelayUnit unit,
                                  BackOffCallback<? super T> runCallback,
                                  TaskCallback<? super T> successCallback,
                                  T arg) {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(runCallback, "runCallback must not be null");
        requireNotNegative("initDelay", initDelay);
        requireNotNegative("maxDelay", maxDelay);
        requireNotNegative("increment", increment);
        if (initDelay == 0 || maxDelay == 0 || increment == 0) {
            log.warn("Rejecting back-off task: initDelay={}, maxDelay={}, increment={}", initDelay, maxDelay, increment);
            return TaskHandles.INVALID;
        }

        RepeatingTask.Builder<T> builder = RepeatingTask.<T>builder(handleCounter.incrementAndGet(), RepeatMode.BACK_OFF, lockPolicy)
                .backOff(runCallback, successCallback)
                .delays(unit.toNanos(initDelay), unit.toNanos(maxDelay), unit.toNanos(increment))
                .argument(arg);
        return launch(builder.build());
    }

    private long launch(RepeatingTask<?> task) {
        long handle = task.handle();
        tasks.put(handle, task);

        // checked after registering so a concurrent shutdown either sees the task or we see the flag
        if (closed.get()) {
            tasks.remove(handle, task);
            log.warn("Rejecting repeating task: scheduler is shut down");
            return TaskHandles.INVALID;
        }

        Thread worker = Threads.newThread("rptTask:" + handle, () -> {
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

        log.debug("Started repeating task {}", handle);
        return handle;
    }

    @Override
    public CancelResult cancel(long handle) {
        // unregister first so the handle stops matching before we wait on the worker
        RepeatingTask<?> task = tasks.remove(handle);
        if (task == null) {
            return CancelResult.notFound();
        }
        CancelResult result = task.cancel();
        log.debug("Canceled repeating task {}; canceled={}", handle, result.canceled());
        return result;
    }

    @Override
    public boolean shortCircuit(long handle) {
        RepeatingTask<?> task = tasks.get(handle);
        return task != null && task.shortCircuit();
    }

    @Override
    public boolean changeInterval(long handle, long amount, DelayUnit unit, boolean changeNow) {
        Objects.requireNonNull(unit, "unit must not be null");
        requireNotNegative("amount", amount);
        if (amount == 0) {
            return false;
        }
        RepeatingTask<?> task = tasks.get(handle);
        return task != null && task.changeInterval(unit.toNanos(amount), changeNow);
    }

    @Override
    public boolean isActive(long handle) {
        RepeatingTask<?> task = tasks.get(handle);
        return task != null && task.isActive();
    }

    @Override
    public int activeCount() {
        return tasks.size();
    }

    @Override
    public List<Object> shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return List.of();
        }

        List<Object> arguments = new ArrayList<>();
        for (Long handle : new ArrayList<>(tasks.keySet())) {
            CancelResult result = cancel(handle);
            if (result.canceled()) {
                arguments.add(result.argument());
            }
        }
        log.info("Repeating task scheduler shut down; canceled={}", arguments.size());
        return arguments;
    }

    private static void requireNotNegative(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
