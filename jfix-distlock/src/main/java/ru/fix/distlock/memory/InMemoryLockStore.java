package ru.fix.distlock.memory;

import ru.fix.distlock.LockRecord;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local lock store. Every operation is atomic per lock name.
 * <p>
 * Share one store between several {@link InMemoryLocker} instances to coordinate owners inside one JVM.
 */
public class InMemoryLockStore {

    public enum ReleaseResult {
        /**
         * Record was owned by the caller and removed
         */
        RELEASED,
        /**
         * No record, nothing to remove
         */
        ABSENT,
        /**
         * Record belongs to another owner, left untouched
         */
        OWNED_BY_OTHER
    }

    private final Map<String, LockRecord> records = new ConcurrentHashMap<>();

    /**
     * Creates the record if absent, stale, or already owned by {@code ownerId}.
     *
     * @return the record that is active after the attempt; owned by somebody else if acquisition failed
     */
    public LockRecord acquire(String name, String ownerId, Instant now, Instant expiredAt) {
        return records.compute(name, (key, existing) -> {
            if (existing == null || existing.isExpiredAt(now) || existing.isOwnedBy(ownerId)) {
                return new LockRecord(name, ownerId, expiredAt);
            }
            return existing;
        });
    }

    /**
     * Moves expiration of a record owned by {@code ownerId}.
     * An expired record that nobody reclaimed is still extended.
     *
     * @return false if there is no record of this owner
     */
    public boolean extend(String name, String ownerId, Instant expiredAt) {
        boolean[] extended = {false};
        records.computeIfPresent(name, (key, existing) -> {
            if (!existing.isOwnedBy(ownerId)) {
                return existing;
            }
            extended[0] = true;
            return new LockRecord(name, ownerId, expiredAt);
        });
        return extended[0];
    }

    public ReleaseResult release(String name, String ownerId) {
        ReleaseResult[] result = {ReleaseResult.ABSENT};
        records.computeIfPresent(name, (key, existing) -> {
            if (existing.isOwnedBy(ownerId)) {
                result[0] = ReleaseResult.RELEASED;
                return null;
            }
            result[0] = ReleaseResult.OWNED_BY_OTHER;
            return existing;
        });
        return result[0];
    }

    public Optional<LockRecord> find(String name) {
        return Optional.ofNullable(records.get(name));
    }
}
