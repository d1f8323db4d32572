package io.taskkit.internal;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Unit of work queued on an executor or pool backlog.
 *
 * <p>Whoever takes a container out of a queue owns it and must call exactly one of
 * {@link #runThenRelease()} or {@link #release()}.
 */
public final class TaskContainer {

    private final Runnable run;
    private final Runnable release;
    private final Object argument;

    private TaskContainer(Runnable run, Runnable release, Object argument) {
        this.run = run;
        this.release = release;
        this.argument = argument;
    }

    /**
     * Executor flavour: {@code runFn(task, arg)} then {@code freeFn(task, arg)}.
     */
    public static <T, A> TaskContainer forExecutor(T task, A arg,
                                                   BiConsumer<? super T, ? super A> runFn,
                                                   BiConsumer<? super T, ? super A> freeFn) {
        Objects.requireNonNull(runFn, "runFn must not be null");
        Runnable release = freeFn == null ? () -> { } : () -> freeFn.accept(task, arg);
        return new TaskContainer(() -> runFn.accept(task, arg), release, arg);
    }

    /**
     * Pool flavour: {@code task(arg)} then {@code freeFn(arg)}.
     */
    public static <T> TaskContainer forPool(Consumer<? super T> task, T arg, Consumer<? super T> freeFn) {
        Objects.requireNonNull(task, "task must not be null");
        Runnable release = freeFn == null ? () -> { } : () -> freeFn.accept(arg);
        return new TaskContainer(() -> task.accept(arg), release, arg);
    }

    /**
     * Run the task; the cleanup runs even if the task throws.
     */
    public void runThenRelease() {
        try {
            run.run();
        } finally {
            release.run();
        }
    }

    /**
     * Cleanup alone, for a task that will never run.
     */
    public void release() {
        release.run();
    }

    public Object argument() {
        return argument;
    }
}
