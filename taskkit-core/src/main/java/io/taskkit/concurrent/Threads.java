package io.taskkit.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for the named daemon threads that back every task front-end.
 */
public final class Threads {
    private static final Logger log = LoggerFactory.getLogger(Threads.class);

    /**
     * Longest name the host OS keeps for a thread; longer names are cut to this length.
     */
    public static final int MAX_NAME_LENGTH = 15;

    static final Thread.UncaughtExceptionHandler LOGGING_HANDLER =
            (t, e) -> log.error("Uncaught failure on thread {}", t.getName(), e);

    private Threads() {
    }

    /**
     * Start a joinable thread.
     *
     * @return the started thread, or empty if the JVM could not create one
     */
    public static Optional<Thread> start(String name, Runnable task) {
        Thread thread = newThread(name, task);
        return start(thread) ? Optional.of(thread) : Optional.empty();
    }

    /**
     * Start a thread nobody will join.
     *
     * @return false if the JVM could not create the thread
     */
    public static boolean startDetached(String name, Runnable task) {
        return start(newThread(name, task));
    }

    /**
     * Start a thread made by {@link #newThread(String, Runnable)}.
     *
     * @return false if the JVM could not create the native thread
     */
    public static boolean start(Thread thread) {
        try {
            thread.start();
            return true;
        } catch (OutOfMemoryError e) {
            log.warn("Unable to create thread {}: {}", thread.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Named daemon thread, not yet started, that logs uncaught failures.
     */
    public static Thread newThread(String name, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        Thread thread = new Thread(task);
        thread.setName(threadName(name));
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
        return thread;
    }

    /**
     * Thread name as the host OS would store it.
     */
    public static String threadName(String name) {
        if (name == null || name.isEmpty()) {
            return "taskkit";
        }
        if (name.length() > MAX_NAME_LENGTH) {
            log.debug("thread name '{}' is too long, truncating to {} chars", name, MAX_NAME_LENGTH);
            return name.substring(0, MAX_NAME_LENGTH);
        }
        return name;
    }

    public static boolean isCurrent(Thread thread) {
        return thread == Thread.currentThread();
    }

    /**
     * Wait for {@code thread} to end. Joining the current thread or a null thread returns at once.
     *
     * @return false if interrupted while waiting; the interrupt flag is restored
     */
    public static boolean joinQuietly(Thread thread) {
        if (thread == null || isCurrent(thread)) {
            return true;
        }
        try {
            thread.join();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
