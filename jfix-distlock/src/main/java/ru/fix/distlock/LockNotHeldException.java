package ru.fix.distlock;

/**
 * Renew or release addressed a record that does not exist or belongs to another owner.
 */
public class LockNotHeldException extends LockException {

    public LockNotHeldException(String lockName, String message) {
        super(lockName, message);
    }
}
