package io.taskkit.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * What a {@link GuardedLock} does when it detects misuse.
 */
public enum LockMisusePolicy {
    /**
     * Log and halt the JVM. Meant for debug and test builds where misuse must never go unnoticed.
     */
    ABORT {
        @Override
        void handle(String lockName, String problem) {
            log.error("Lock misuse on {}: {}. Halting.", lockName, problem);
            Runtime.getRuntime().halt(EXIT_CODE);
        }
    },
    /**
     * Log and throw {@link LockMisuseException}.
     */
    RAISE {
        @Override
        void handle(String lockName, String problem) {
            log.error("Lock misuse on {}: {}", lockName, problem);
            throw new LockMisuseException(lockName + ": " + problem);
        }
    };

    private static final Logger log = LoggerFactory.getLogger(LockMisusePolicy.class);

    // same status as a process killed by SIGABRT
    static final int EXIT_CODE = 134;

    abstract void handle(String lockName, String problem);
}
