package io.taskkit.internal.repeat;

import io.taskkit.BackOffCallback;
import io.taskkit.TaskCallback;
import io.taskkit.concurrent.GuardedLock;
import io.taskkit.concurrent.LockMisusePolicy;
import io.taskkit.concurrent.Threads;
import io.taskkit.core.CancelResult;
import io.taskkit.core.RepeatMode;
import io.taskkit.core.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;

/**
 * Control block of a repeating task, driven by one dedicated worker thread.
 *
 * <p>The worker loops: pause until the target time (unless short-circuited), run, compute the
 * next target. Cancellation is checked before every pause and after every wake.
 */
final class RepeatingTask<T> {
    private static final Logger log = LoggerFactory.getLogger(RepeatingTask.class);

    private final long handle;
    private final RepeatMode mode;
    private final TaskCallback<? super T> callback;
    private final BackOffCallback<? super T> backOffRun;
    private final TaskCallback<? super T> backOffSuccess;
    private final long maxDelayNanos;
    private final long incrementNanos;

    private final GuardedLock lock;
    private final Condition wakeup;

    private T argument;
    private TaskState state = TaskState.IDLE;
    private long currentDelayNanos;
    private long targetNanos;
    private boolean completed = false;
    private Thread worker;

    private RepeatingTask(Builder<T> builder) {
        this.handle = builder.handle;
        this.mode = builder.mode;
        this.callback = builder.callback;
        this.backOffRun = builder.backOffRun;
        this.backOffSuccess = builder.backOffSuccess;
        this.maxDelayNanos = builder.maxDelayNanos;
        this.incrementNanos = builder.incrementNanos;
        this.currentDelayNanos = builder.delayNanos;
        this.argument = builder.argument;
        this.lock = new GuardedLock("rptTask:" + handle, builder.policy);
        this.wakeup = lock.newCondition();

        // fixed delay/rate run right away; back-off waits its initial delay first
        long now = System.nanoTime();
        this.targetNanos = mode == RepeatMode.BACK_OFF ? saturatedAdd(now, currentDelayNanos) : now;
    }

    static <T> Builder<T> builder(long handle, RepeatMode mode, LockMisusePolicy policy) {
        return new Builder<>(handle, mode, policy);
    }

    long handle() {
        return handle;
    }

    void attach(Thread worker) {
        lock.lock();
        try {
            this.worker = worker;
        } finally {
            lock.unlock();
        }
    }

    void run() {
        boolean succeeded = false;

        while (true) {
            TaskState entryState;
            lock.lock();
            try {
                if (state == TaskState.CANCELED) {
                    break;
                }
                if (state != TaskState.SHORT_CIRCUIT) {
                    state = TaskState.WAITING;
                    long remaining = targetNanos - System.nanoTime();
                    while (state == TaskState.WAITING && remaining > 0L) {
                        wakeup.awaitNanos(remaining);
                        remaining = targetNanos - System.nanoTime();
                    }
                    if (state == TaskState.CANCELED) {
                        break;
                    }
                }
                entryState = state;
                state = TaskState.RUNNING;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Repeating task {} interrupted while waiting; stopping it", handle);
                state = TaskState.CANCELED;
                break;
            } finally {
                lock.unlock();
            }

            if (mode == RepeatMode.BACK_OFF) {
                if (backOffRun.run(argument)) {
                    succeeded = true;
                    break;
                }
            } else {
                callback.run(argument);
            }

            lock.lock();
            try {
                scheduleNext(entryState);
            } finally {
                lock.unlock();
            }
        }

        if (succeeded) {
            complete();
        }
    }

    /**
     * Assumes the lock is held.
     */
    private void scheduleNext(TaskState entryState) {
        long now = System.nanoTime();
        switch (mode) {
            case BACK_OFF -> {
                currentDelayNanos = Math.min(saturatedAdd(currentDelayNanos, incrementNanos), maxDelayNanos);
                targetNanos = saturatedAdd(now, currentDelayNanos);
            }
            case FIXED_RATE -> {
                // a short-circuited run restarts the cadence from now
                targetNanos = entryState == TaskState.SHORT_CIRCUIT
                        ? saturatedAdd(now, currentDelayNanos)
                        : saturatedAdd(targetNanos, currentDelayNanos);
            }
            default -> targetNanos = saturatedAdd(now, currentDelayNanos);
        }
    }

    private void complete() {
        T arg;
        lock.lock();
        try {
            // a concurrent cancel must not hand back an argument the success callback now owns
            completed = true;
            state = TaskState.CANCELED;
            arg = argument;
            argument = null;
        } finally {
            lock.unlock();
        }
        log.debug("Back-off task {} succeeded", handle);
        if (backOffSuccess != null) {
            backOffSuccess.run(arg);
        }
    }

    /**
     * Stop the task, waiting for an in-flight iteration unless called from the task's own thread.
     */
    CancelResult cancel() {
        Thread joinOn;
        lock.lock();
        try {
            if (state == TaskState.CANCELED) {
                return CancelResult.notFound();
            }
            state = TaskState.CANCELED;
            wakeup.signalAll();
            joinOn = worker;
        } finally {
            lock.unlock();
        }

        Threads.joinQuietly(joinOn);

        lock.lock();
        try {
            if (completed) {
                return CancelResult.notFound();
            }
            T arg = argument;
            argument = null;
            return CancelResult.canceled(arg);
        } finally {
            lock.unlock();
        }
    }

    boolean shortCircuit() {
        lock.lock();
        try {
            if (state == TaskState.CANCELED) {
                return false;
            }
            state = TaskState.SHORT_CIRCUIT;
            wakeup.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean changeInterval(long delayNanos, boolean changeNow) {
        lock.lock();
        try {
            if (state == TaskState.CANCELED) {
                return false;
            }
            currentDelayNanos = delayNanos;
            // while running, the worker computes the next target itself
            if (changeNow && state != TaskState.RUNNING) {
                targetNanos = saturatedAdd(System.nanoTime(), delayNanos);
                wakeup.signalAll();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isActive() {
        lock.lock();
        try {
            return state != TaskState.CANCELED;
        } finally {
            lock.unlock();
        }
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        // overflow iff both operands have the same sign and the result's sign differs
        if (((a ^ r) & (b ^ r)) < 0) {
            return Long.MAX_VALUE;
        }
        return r;
    }

    static final class Builder<T> {
        private final long handle;
        private final RepeatMode mode;
        private final LockMisusePolicy policy;
        private TaskCallback<? super T> callback;
        private BackOffCallback<? super T> backOffRun;
        private TaskCallback<? super T> backOffSuccess;
        private long delayNanos;
        private long maxDelayNanos;
        private long incrementNanos;
        private T argument;

        private Builder(long handle, RepeatMode mode, LockMisusePolicy policy) {
            this.handle = handle;
            this.mode = mode;
            this.policy = policy;
        }

        Builder<T> callback(TaskCallback<? super T> callback) {
            this.callback = callback;
            return this;
        }

        Builder<T> backOff(BackOffCallback<? super T> run, TaskCallback<? super T> success) {
            this.backOffRun = run;
            this.backOffSuccess = success;
            return this;
        }

        Builder<T> delays(long delayNanos, long maxDelayNanos, long incrementNanos) {
            this.delayNanos = delayNanos;
            this.maxDelayNanos = maxDelayNanos;
            this.incrementNanos = incrementNanos;
            return this;
        }

        Builder<T> argument(T argument) {
            this.argument = argument;
            return this;
        }

        RepeatingTask<T> build() {
            return new RepeatingTask<>(this);
        }
    }
}
