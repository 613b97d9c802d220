package ru.fix.distlock;

import lombok.Value;

import java.time.Instant;

/**
 * Backend-resident lock: at most one active record exists per name.
 */
@Value
public class LockRecord {
    String name;
    String ownerId;
    Instant expiredAt;

    public boolean isOwnedBy(String ownerId) {
        return this.ownerId.equals(ownerId);
    }

    /**
     * Stale records may be reclaimed by another owner.
     */
    public boolean isExpiredAt(Instant now) {
        return expiredAt.isBefore(now);
    }
}
