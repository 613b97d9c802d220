package ru.fix.distlock;

import javax.annotation.Nullable;

/**
 * Lock is held by a live, non-expired record of another owner.
 * Recoverable: caller may retry after a delay.
 */
public class LockAcquisitionConflictException extends LockException {

    @Nullable
    private final String currentOwner;

    public LockAcquisitionConflictException(String lockName, @Nullable String currentOwner) {
        super(lockName, "Lock " + lockName + " is already held by " +
                (currentOwner == null ? "another owner" : currentOwner));
        this.currentOwner = currentOwner;
    }

    /**
     * @return owner of the live record, or {@code null} if the record disappeared before it could be read
     */
    @Nullable
    public String getCurrentOwner() {
        return currentOwner;
    }
}
