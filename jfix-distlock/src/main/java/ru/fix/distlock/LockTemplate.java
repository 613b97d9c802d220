package ru.fix.distlock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Poll-and-sleep acquisition on top of single-attempt {@link Locker#lock()}.
 * <p>
 * Conflicts and transport failures are retried alike until {@code acquiringTimeout} expires.
 */
public class LockTemplate {

    private static final Logger logger = LoggerFactory.getLogger(LockTemplate.class);

    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);

    private final Duration acquiringTimeout;
    private final Duration retryInterval;

    /**
     * @param acquiringTimeout max amount of time which could be spent trying to acquire the lock
     * @param retryInterval    pause between two attempts
     */
    public LockTemplate(Duration acquiringTimeout, Duration retryInterval) {
        this.acquiringTimeout = Objects.requireNonNull(acquiringTimeout, "acquiringTimeout");
        this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval");
        if (acquiringTimeout.isNegative()) {
            throw new LockConfigurationException("Invalid configuration. acquiringTimeout should not be negative");
        }
        if (retryInterval.isNegative() || retryInterval.isZero()) {
            throw new LockConfigurationException("Invalid configuration. retryInterval should be positive");
        }
    }

    public LockTemplate(Duration acquiringTimeout) {
        this(acquiringTimeout, DEFAULT_RETRY_INTERVAL);
    }

    /**
     * Acquire the lock. Blocks until lock will be acquired, or the acquiringTimeout expires.
     *
     * @return true if the lock was acquired, false if not
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public boolean tryLock(Locker locker) throws InterruptedException {
        try {
            acquire(locker);
            return true;
        } catch (LockException e) {
            return false;
        }
    }

    /**
     * Acquires the lock, runs the action and releases the lock.
     * A failure to release is logged and does not hide the result of the action.
     *
     * @throws LockException the lock was not acquired within acquiringTimeout, the last failure is rethrown
     */
    public <T> T executeWithLock(Locker locker, LockCallback<T> action) throws Exception {
        Objects.requireNonNull(action, "action");
        acquire(locker);
        try {
            return action.doInLock();
        } finally {
            try {
                locker.unlock();
            } catch (LockException e) {
                logger.error("Failed to release lock {} after action", locker.getLockName(), e);
            }
        }
    }

    private void acquire(Locker locker) throws LockException, InterruptedException {
        Objects.requireNonNull(locker, "locker");
        final long deadline = System.nanoTime() + acquiringTimeout.toNanos();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                locker.lock();
                return;
            } catch (LockException e) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    logger.debug("Couldn't acquire lock '{}' in {} attempts. Acquiring timeout {} expired",
                            locker.getLockName(), attempt, acquiringTimeout);
                    throw e;
                }
                long pauseMillis = Math.max(1, Math.min(retryInterval.toMillis(), remainingNanos / 1_000_000));
                logger.debug("Can't acquire lock '{}': {}. Next attempt in {} ms",
                        locker.getLockName(), e.getMessage(), pauseMillis);
                Thread.sleep(pauseMillis);
            }
        }
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock() throws Exception;
    }
}
