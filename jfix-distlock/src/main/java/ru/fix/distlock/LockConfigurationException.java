package ru.fix.distlock;

/**
 * Invalid construction parameters of a locker or its configuration.
 */
public class LockConfigurationException extends IllegalArgumentException {

    public LockConfigurationException(String message) {
        super(message);
    }

    public LockConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
