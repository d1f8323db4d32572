package io.taskkit.internal.executor;

import io.taskkit.TaskExecutor;
import io.taskkit.concurrent.BoundedBlockingQueue;
import io.taskkit.concurrent.Threads;
import io.taskkit.core.ExecutorState;
import io.taskkit.internal.TaskContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * {@link TaskExecutor} backed by one worker thread and a bounded FIFO backlog.
 *
 * <p>The executor state lives outside any lock: submitters block on the queue only, so a full
 * backlog never stalls the worker or a concurrent destroy.
 */
public class SerialTaskExecutor implements TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(SerialTaskExecutor.class);

    private final String name;
    private final Options options;
    private final BoundedBlockingQueue<TaskContainer> queue;
    private final AtomicReference<ExecutorState> state = new AtomicReference<>(ExecutorState.RUN);
    private final Thread worker;

    private SerialTaskExecutor(String name, Options options) {
        this.name = name;
        this.options = options;
        this.queue = new BoundedBlockingQueue<>(options.queueCapacity());
        this.worker = Threads.newThread(name, this::workLoop);
    }

    /**
     * Create an executor and start its worker.
     *
     * @throws IllegalStateException if the worker thread could not be started
     */
    public static SerialTaskExecutor start(String name, Options options) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (options.queueCapacity() <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + options.queueCapacity());
        }
        requirePositive("submitTimeout", options.submitTimeout());
        requirePositive("pollInterval", options.pollInterval());

        SerialTaskExecutor executor = new SerialTaskExecutor(name, options);
        if (!Threads.start(executor.worker)) {
            executor.state.set(ExecutorState.CANCEL);
            throw new IllegalStateException("Unable to start worker for executor " + name);
        }
        log.info("Task executor {} started; queueCapacity={}", name, options.queueCapacity());
        return executor;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutorState state() {
        return state.get();
    }

    @Override
    public <T, A> boolean submit(T task, A arg, BiConsumer<? super T, ? super A> runFn, BiConsumer<? super T, ? super A> freeFn) {
        TaskContainer container = TaskContainer.forExecutor(task, arg, runFn, freeFn);

        boolean queued = false;
        if (state.get() == ExecutorState.RUN) {
            try {
                queued = queue.push(container, options.submitTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (!queued) {
            log.warn("Executor {} rejected task; state={}, backlog={}", name, state.get(), queue.count());
            container.release();
        }
        return queued;
    }

    @Override
    public int backlogCount() {
        if (state.get() == ExecutorState.CANCEL) {
            return 0;
        }
        return queue.count();
    }

    @Override
    public void clear() {
        if (state.get() != ExecutorState.RUN) {
            return;
        }
        int dropped = queue.clear(TaskContainer::release);
        log.debug("Executor {} cleared {} queued tasks", name, dropped);
    }

    @Override
    public void destroy() {
        if (state.getAndSet(ExecutorState.CANCEL) == ExecutorState.CANCEL) {
            return;
        }
        queue.disable();
        Threads.joinQuietly(worker);
        int dropped = queue.clear(TaskContainer::release);
        log.info("Task executor {} destroyed; dropped={}", name, dropped);
    }

    @Override
    public void drainAndDestroy() {
        if (!state.compareAndSet(ExecutorState.RUN, ExecutorState.FINISH)) {
            return;
        }
        log.info("Task executor {} draining; backlog={}", name, queue.count());
        if (Threads.isCurrent(worker)) {
            // the worker finishes the drain and tears itself down
            return;
        }
        if (queue.count() == 0) {
            // nothing to drain: wake the idle worker instead of waiting out its poll
            queue.disable();
        }
        Threads.joinQuietly(worker);
        destroy();
    }

    private void workLoop() {
        while (true) {
            ExecutorState current = state.get();
            if (current == ExecutorState.CANCEL) {
                break;
            }
            if (current == ExecutorState.FINISH && (queue.count() == 0 || queue.isDisabled())) {
                break;
            }

            TaskContainer container;
            try {
                container = queue.pop(options.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Executor {} worker interrupted; stopping", name);
                break;
            }

            if (container != null) {
                execute(container);
            }
        }

        // drained from inside a task: nobody else will finish the teardown
        if (state.compareAndSet(ExecutorState.FINISH, ExecutorState.CANCEL)) {
            queue.disable();
            // tasks accepted after the last emptiness check still run; the disabled queue takes no more
            int late = queue.clear(this::execute);
            log.info("Task executor {} drained and destroyed; late={}", name, late);
        }
        log.debug("Executor {} worker exiting", name);
    }

    private void execute(TaskContainer container) {
        try {
            container.runThenRelease();
        } catch (RuntimeException e) {
            log.error("Executor {} task failed", name, e);
        }
    }

    private static void requirePositive(String field, Duration value) {
        Objects.requireNonNull(value, field + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be a positive duration");
        }
    }
}
