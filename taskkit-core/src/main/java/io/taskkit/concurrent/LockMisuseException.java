package io.taskkit.concurrent;

/**
 * Thrown by a {@link GuardedLock} under {@link LockMisusePolicy#RAISE} when a thread locks a lock it
 * already holds or unlocks a lock it does not own.
 */
public class LockMisuseException extends IllegalStateException {

    public LockMisuseException(String message) {
        super(message);
    }
}
