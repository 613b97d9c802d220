package ru.fix.distlock;

/**
 * The backend call itself failed: network, authentication, timeout or interruption.
 */
public class LockTransportException extends LockException {

    public LockTransportException(String lockName, String message) {
        super(lockName, message);
    }

    public LockTransportException(String lockName, String message, Throwable cause) {
        super(lockName, message, cause);
    }
}
