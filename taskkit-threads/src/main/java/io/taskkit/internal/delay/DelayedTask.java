package io.taskkit.internal.delay;

import io.taskkit.TaskCallback;
import io.taskkit.concurrent.GuardedLock;
import io.taskkit.concurrent.LockMisusePolicy;
import io.taskkit.core.CancelResult;
import io.taskkit.core.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;

/**
 * One-shot task control block. Owned by its worker thread; the registry only ever hands out the handle.
 */
final class DelayedTask<T> {
    private static final Logger log = LoggerFactory.getLogger(DelayedTask.class);

    private final long handle;
    private final TaskCallback<? super T> callback;
    private final GuardedLock lock;
    private final Condition wakeup;

    private T argument;
    private TaskState state = TaskState.IDLE;
    private long delayNanos;
    private long startNanos;
    private Thread worker;

    DelayedTask(long handle, long delayNanos, TaskCallback<? super T> callback, T argument, LockMisusePolicy policy) {
        this.handle = handle;
        this.delayNanos = delayNanos;
        this.callback = callback;
        this.argument = argument;
        this.lock = new GuardedLock("delayedTask:" + handle, policy);
        this.wakeup = lock.newCondition();
        this.startNanos = System.nanoTime();
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

    Thread worker() {
        lock.lock();
        try {
            return worker;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Worker body: wait out the delay, then run the callback once unless canceled.
     */
    void run() {
        boolean fire;
        lock.lock();
        try {
            // a force or cancel may already have landed
            if (state == TaskState.IDLE) {
                state = TaskState.WAITING;
            }

            long remaining = remainingNanos();
            while (state == TaskState.WAITING && remaining > 0L) {
                wakeup.awaitNanos(remaining);
                remaining = remainingNanos();
            }

            fire = state != TaskState.CANCELED;
            if (fire) {
                state = TaskState.RUNNING;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Delayed task {} interrupted while waiting; dropping it", handle);
            state = TaskState.CANCELED;
            fire = false;
        } finally {
            lock.unlock();
        }

        if (!fire) {
            log.debug("Delayed task {} canceled before running", handle);
            return;
        }

        try {
            callback.run(argument);
        } finally {
            // the callback owned the argument
            argument = null;
        }
    }

    boolean isWaiting() {
        lock.lock();
        try {
            return state.isCancelable();
        } finally {
            lock.unlock();
        }
    }

    CancelResult cancel() {
        lock.lock();
        try {
            if (!state.isCancelable()) {
                return CancelResult.notFound();
            }
            state = TaskState.CANCELED;
            wakeup.signalAll();
            T arg = argument;
            argument = null;
            return CancelResult.canceled(arg);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Make the worker run the callback now.
     */
    boolean force() {
        lock.lock();
        try {
            if (!state.isCancelable()) {
                return false;
            }
            state = TaskState.RUNNING;
            wakeup.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean reschedule(long delayNanos) {
        lock.lock();
        try {
            if (!state.isCancelable()) {
                return false;
            }
            this.delayNanos = delayNanos;
            this.startNanos = System.nanoTime();
            wakeup.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private long remainingNanos() {
        long elapsed = System.nanoTime() - startNanos;
        return delayNanos - elapsed;
    }
}
