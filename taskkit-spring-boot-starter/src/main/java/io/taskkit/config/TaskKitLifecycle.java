package io.taskkit.config;

import io.taskkit.TaskKit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges TaskKit start/stop with the Spring container lifecycle.
 *
 * <p>Runs in the last phase, so TaskKit starts after every other lifecycle bean and stops before them.
 * Running state is read from the kit itself, so a kit stopped by application code is not stopped twice.
 */
public class TaskKitLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TaskKitLifecycle.class);

    private final TaskKit taskKit;

    public TaskKitLifecycle(TaskKit taskKit) {
        this.taskKit = taskKit;
    }

    @Override
    public void start() {
        taskKit.start();
    }

    @Override
    public void stop() {
        if (!taskKit.isRunning()) {
            log.debug("TaskKit already stopped; nothing to do on context shutdown");
            return;
        }
        taskKit.stop();
    }

    @Override
    public boolean isRunning() {
        return taskKit.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
