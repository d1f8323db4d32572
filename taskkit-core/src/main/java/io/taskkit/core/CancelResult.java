package io.taskkit.core;

/**
 * Result of canceling a delayed or repeating task.
 *
 * canceled : true if the task was stopped before (another) callback invocation
 * argument : the argument originally supplied when scheduling; ownership returns to the caller
 */
public record CancelResult(
        boolean canceled,
        Object argument
) {

    public static CancelResult notFound() {
        return new CancelResult(false, null);
    }

    public static CancelResult canceled(Object argument) {
        return new CancelResult(true, argument);
    }

    /**
     * Typed view of {@link #argument()}.
     *
     * @throws ClassCastException if the argument is not a {@code type}
     */
    public <T> T argument(Class<T> type) {
        return type.cast(argument);
    }
}
