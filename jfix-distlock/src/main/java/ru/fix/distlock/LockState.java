package ru.fix.distlock;

/**
 * Phase of a {@link Locker} instance as seen by its owner.
 * <p>
 * Expiration of the backend record is not a state: the holder learns about it
 * only through a failed {@link Locker#renew()} or {@link Locker#unlock()}.
 */
public enum LockState {
    IDLE,
    ACQUIRING,
    HELD,
    RENEWING,
    RELEASED
}
