package ru.fix.distlock;

import java.time.Duration;

/**
 * Locker without a backend: every operation succeeds.
 * For single-instance deployments and tests. Background renewal still runs and logs.
 */
public class NoopLocker extends AbstractLocker {

    public NoopLocker(LockConfig config) {
        super(config);
    }

    public NoopLocker() {
        this(LockConfig.defaults());
    }

    @Override
    protected void doLock(Duration timeout) {
        logger.debug("Noop lock acquired lockName={} ownerId={}", config.getLockName(), config.getOwnerId());
    }

    @Override
    protected void doRenew(Duration timeout) {
        logger.debug("Noop lock renewed lockName={} ownerId={}", config.getLockName(), config.getOwnerId());
    }

    @Override
    protected void doUnlock(Duration timeout) {
        logger.debug("Noop lock released lockName={} ownerId={}", config.getLockName(), config.getOwnerId());
    }
}
