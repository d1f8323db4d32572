package io.taskkit.core;

public enum ExecutorState {
    /** Accepting and running tasks. */
    RUN,
    /** Draining: no new submissions, the backlog still runs. */
    FINISH,
    /** Terminal. */
    CANCEL
}
