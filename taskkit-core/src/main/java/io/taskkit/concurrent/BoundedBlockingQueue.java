package io.taskkit.concurrent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Fixed-capacity FIFO shared by producers and worker threads.
 *
 * <p>Producers block while the queue is full and consumers block while it is empty, each for at
 * most the given timeout. Once {@link #disable() disabled} every blocked caller is released and any
 * later push or pop fails immediately; items still queued stay there until cleared or destroyed.
 *
 * <p>Cleanup callbacks passed to {@link #clear(Consumer)}, {@link #delete(Predicate, Consumer)} and
 * {@link #destroy(Consumer)} run after the queue lock is released.
 */
public final class BoundedBlockingQueue<E> {

    public static final int MAX_CAPACITY = 65535;

    private final ArrayDeque<E> items;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    private boolean enabled = true;

    /**
     * @param capacity max number of queued items; 0 means {@link #MAX_CAPACITY}
     */
    public BoundedBlockingQueue(int capacity) {
        if (capacity < 0 || capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("capacity must be between 0 and " + MAX_CAPACITY + ": " + capacity);
        }
        this.capacity = capacity == 0 ? MAX_CAPACITY : capacity;
        this.items = new ArrayDeque<>(Math.min(this.capacity, 256));
    }

    public int capacity() {
        return capacity;
    }

    public int count() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append {@code item}, waiting as long as needed for room.
     *
     * @return false if the queue is (or becomes) disabled
     */
    public boolean push(E item) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        lock.lock();
        try {
            while (enabled && items.size() >= capacity) {
                notFull.await();
            }
            return offerLocked(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append {@code item}, waiting at most {@code timeout} for room. A zero timeout never waits.
     *
     * @return false on timeout or if the queue is disabled
     */
    public boolean push(E item, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        long nanos = toNanos(timeout);
        lock.lock();
        try {
            while (enabled && items.size() >= capacity) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            return offerLocked(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the oldest item, waiting as long as needed for one.
     *
     * @return the item, or null if the queue is (or becomes) disabled
     */
    public E pop() throws InterruptedException {
        lock.lock();
        try {
            while (enabled && items.isEmpty()) {
                notEmpty.await();
            }
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the oldest item, waiting at most {@code timeout}. A zero timeout never waits.
     *
     * @return the item, or null on timeout or if the queue is disabled
     */
    public E pop(Duration timeout) throws InterruptedException {
        long nanos = toNanos(timeout);
        lock.lock();
        try {
            while (enabled && items.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return pollLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release every blocked producer and consumer and make further push/pop fail. Idempotent.
     */
    public void disable() {
        lock.lock();
        try {
            enabled = false;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDisabled() {
        lock.lock();
        try {
            return !enabled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every item, handing each to {@code cleanup} (optional) in FIFO order.
     *
     * @return number of items removed
     */
    public int clear(Consumer<? super E> cleanup) {
        List<E> removed;
        lock.lock();
        try {
            removed = new ArrayList<>(items);
            items.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        release(removed, cleanup);
        return removed.size();
    }

    /**
     * Remove the oldest item matching {@code matcher}, handing it to {@code cleanup} (optional).
     *
     * @return true if an item was removed
     */
    public boolean delete(Predicate<? super E> matcher, Consumer<? super E> cleanup) {
        Objects.requireNonNull(matcher, "matcher must not be null");
        E removed = null;
        lock.lock();
        try {
            Iterator<E> it = items.iterator();
            while (it.hasNext()) {
                E item = it.next();
                if (matcher.test(item)) {
                    it.remove();
                    removed = item;
                    notFull.signal();
                    break;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed != null && cleanup != null) {
            cleanup.accept(removed);
        }
        return removed != null;
    }

    /**
     * Visit queued items oldest first, under the queue lock, until {@code visitor} returns false.
     * The visitor must not call back into this queue.
     */
    public void iterate(Predicate<? super E> visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        lock.lock();
        try {
            for (E item : items) {
                if (!visitor.test(item)) {
                    break;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disable the queue and clear it.
     */
    public void destroy(Consumer<? super E> cleanup) {
        disable();
        clear(cleanup);
    }

    private boolean offerLocked(E item) {
        if (!enabled) {
            return false;
        }
        items.addLast(item);
        notEmpty.signal();
        return true;
    }

    private E pollLocked() {
        if (!enabled) {
            return null;
        }
        E item = items.pollFirst();
        if (item != null) {
            notFull.signal();
        }
        return item;
    }

    private static long toNanos(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            return 0L;
        }
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static <E> void release(List<E> removed, Consumer<? super E> cleanup) {
        if (cleanup == null) {
            return;
        }
        for (E item : removed) {
            cleanup.accept(item);
        }
    }
}
