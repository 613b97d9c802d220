package ru.fix.distlock;

@FunctionalInterface
public interface LockRenewalFailedListener {

    LockRenewalFailedListener NO_OP = (lockName, cause) -> {
    };

    /**
     * Background renewal of the lock failed.
     * Either due to connection problem, or the record was removed, expired or taken by another owner.
     * The locker stays in {@link LockState#HELD}; the listener decides whether to treat this as loss of the lock.
     * Invoked on the renewal thread, outside the locker's critical section.
     */
    void onLockRenewalFailed(String lockName, LockException cause);
}
