package io.taskkit;


/**
 * Work run by a delayed or repeating task. The callback owns {@code arg} once invoked.
 */
@FunctionalInterface
public interface TaskCallback<T> {
    void run(T arg);
}
