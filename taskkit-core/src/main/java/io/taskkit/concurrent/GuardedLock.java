package io.taskkit.concurrent;

import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Error-checking, non-reentrant mutual exclusion lock.
 *
 * <p>Locking a lock the current thread already holds, or unlocking one it does not hold, is a
 * programming error and is reported through the configured {@link LockMisusePolicy} instead of
 * deadlocking or silently succeeding.
 */
public final class GuardedLock {

    private final String name;
    private final LockMisusePolicy policy;
    private final ReentrantLock delegate = new ReentrantLock();

    public GuardedLock(String name, LockMisusePolicy policy) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public void lock() {
        if (delegate.isHeldByCurrentThread()) {
            policy.handle(name, "already locked by current thread");
            return;
        }
        delegate.lock();
    }

    public void unlock() {
        if (!delegate.isHeldByCurrentThread()) {
            policy.handle(name, "current thread does not own lock");
            return;
        }
        delegate.unlock();
    }

    /**
     * Condition bound to this lock. Awaiting it requires holding the lock.
     */
    public Condition newCondition() {
        return delegate.newCondition();
    }

    public boolean isHeldByCurrentThread() {
        return delegate.isHeldByCurrentThread();
    }
}
