package ru.fix.distlock;

import java.time.Duration;

/**
 * Mutual exclusion of a named resource across processes that share nothing but a coordination store.
 * <p>
 * One instance represents one owner's view of one lock and must not be shared by several logical callers.
 * Operations of the instance, including background renewal, are serialized against each other.
 * <p>
 * {@link #lock()} makes a single attempt and never waits for the lock to become free.
 * Use {@link LockTemplate} for poll-and-retry acquisition.
 */
public interface Locker extends AutoCloseable {

    /**
     * Single attempt to acquire the lock, bounded by {@link LockConfig#getOperationTimeout()}.
     * On success starts background renewal every {@link LockConfig#getRenewalInterval()}.
     * Calling it on a held instance extends the lease.
     *
     * @throws LockAcquisitionConflictException the lock is held by another owner
     * @throws LockTransportException           backend call failed
     */
    void lock() throws LockException;

    void lock(Duration timeout) throws LockException;

    /**
     * Stops background renewal, then removes the backend record.
     * Succeeds if the record is already gone.
     *
     * @throws LockNotHeldException   the record now belongs to another owner, it was left untouched
     * @throws LockTransportException backend call failed, instance stays held and the call may be repeated
     */
    void unlock() throws LockException;

    void unlock(Duration timeout) throws LockException;

    /**
     * Extends the lease without releasing ownership.
     *
     * @throws LockNotHeldException   the instance does not hold the lock, or the record is gone or owned by another owner
     * @throws LockTransportException backend call failed
     */
    void renew() throws LockException;

    void renew(Duration timeout) throws LockException;

    LockState getState();

    String getLockName();

    String getOwnerId();

    /**
     * Releases the lock if held. Failures are logged, never thrown.
     */
    @Override
    void close();
}
