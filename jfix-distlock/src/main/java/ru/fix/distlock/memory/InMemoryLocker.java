package ru.fix.distlock.memory;

import ru.fix.distlock.AbstractLocker;
import ru.fix.distlock.LockAcquisitionConflictException;
import ru.fix.distlock.LockConfig;
import ru.fix.distlock.LockException;
import ru.fix.distlock.LockNotHeldException;
import ru.fix.distlock.LockRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Locker over an {@link InMemoryLockStore}. Expiration follows {@link LockConfig#getClock()}.
 */
public class InMemoryLocker extends AbstractLocker {

    private final InMemoryLockStore store;

    public InMemoryLocker(InMemoryLockStore store, LockConfig config) {
        super(config);
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    protected void doLock(Duration timeout) throws LockException {
        Instant now = config.getClock().instant();
        LockRecord previous = store.find(config.getLockName()).orElse(null);
        LockRecord current = store.acquire(config.getLockName(), config.getOwnerId(), now, now.plus(config.getTimeout()));
        if (!current.isOwnedBy(config.getOwnerId())) {
            throw new LockAcquisitionConflictException(config.getLockName(), current.getOwnerId());
        }
        if (previous != null && !previous.isOwnedBy(config.getOwnerId())) {
            logger.info("Lock expired, updated owner lockName={} previousOwner={} newOwner={}",
                    config.getLockName(), previous.getOwnerId(), config.getOwnerId());
        }
    }

    @Override
    protected void doRenew(Duration timeout) throws LockException {
        Instant expiredAt = config.getClock().instant().plus(config.getTimeout());
        if (!store.extend(config.getLockName(), config.getOwnerId(), expiredAt)) {
            throw new LockNotHeldException(config.getLockName(),
                    "Lock " + config.getLockName() + " is not owned by " + config.getOwnerId());
        }
    }

    @Override
    protected void doUnlock(Duration timeout) throws LockException {
        InMemoryLockStore.ReleaseResult result = store.release(config.getLockName(), config.getOwnerId());
        if (result == InMemoryLockStore.ReleaseResult.OWNED_BY_OTHER) {
            throw new LockNotHeldException(config.getLockName(),
                    "Lock " + config.getLockName() + " is owned by another owner");
        }
        if (result == InMemoryLockStore.ReleaseResult.ABSENT) {
            logger.debug("Lock already released lockName={}", config.getLockName());
        }
    }
}
