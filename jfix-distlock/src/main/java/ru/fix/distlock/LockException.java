package ru.fix.distlock;

/**
 * Base type of every failure a {@link Locker} reports to its caller.
 */
public class LockException extends Exception {

    private final String lockName;

    public LockException(String lockName, String message) {
        super(message);
        this.lockName = lockName;
    }

    public LockException(String lockName, String message, Throwable cause) {
        super(message, cause);
        this.lockName = lockName;
    }

    public String getLockName() {
        return lockName;
    }
}
