package ru.fix.distlock;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock protocol shared by every backend: state machine, critical section and background renewal.
 * <p>
 * Backends implement {@link #doLock(Duration)}, {@link #doRenew(Duration)} and {@link #doUnlock(Duration)}.
 * These are always invoked inside the instance's critical section, so a backend never sees
 * its own renewal interleaving with a release.
 * <p>
 * The critical section provides intra-process serialization only.
 * Cross-process exclusion is the job of the backend's atomic primitives.
 */
@ThreadSafe
public abstract class AbstractLocker implements Locker {

    protected final LockConfig config;
    protected final Logger logger;

    private final ReentrantLock criticalSection = new ReentrantLock();
    private volatile LockState state = LockState.IDLE;
    private LockRenewalScheduler renewalScheduler;

    protected AbstractLocker(@NotNull LockConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.logger = config.getLogger();
    }

    /**
     * Single acquisition attempt against the backend.
     * Implementations treat a live record of the same owner as success where the backend allows to tell.
     */
    protected abstract void doLock(Duration timeout) throws LockException;

    /**
     * Extends the backend record, verifying that it still belongs to this owner.
     */
    protected abstract void doRenew(Duration timeout) throws LockException;

    /**
     * Removes the backend record if it belongs to this owner.
     * Must succeed when the record is already gone.
     */
    protected abstract void doUnlock(Duration timeout) throws LockException;

    @Override
    public void lock() throws LockException {
        lock(config.getOperationTimeout());
    }

    @Override
    public void lock(Duration timeout) throws LockException {
        enterCriticalSection();
        try {
            if (state == LockState.HELD) {
                try {
                    invoke(() -> doRenew(timeout), "renew");
                    logger.debug("Lock already held, lease extended lockName={} ownerId={}",
                            config.getLockName(), config.getOwnerId());
                    // renewal is stopped after an unlock that failed on transport
                    if (renewalScheduler == null) {
                        startRenewal();
                    }
                    return;
                } catch (LockNotHeldException e) {
                    logger.info("Lock held by this instance was lost, acquiring again lockName={} ownerId={}",
                            config.getLockName(), config.getOwnerId());
                    stopRenewal();
                    state = LockState.RELEASED;
                }
            }

            LockState previous = state;
            state = LockState.ACQUIRING;
            try {
                invoke(() -> doLock(timeout), "lock");
            } catch (LockAcquisitionConflictException e) {
                state = previous;
                logger.debug("Lock is already held by another owner lockName={} currentOwner={}",
                        config.getLockName(), e.getCurrentOwner());
                throw e;
            } catch (LockException e) {
                state = previous;
                logger.error("Failed to acquire lock lockName={} ownerId={}",
                        config.getLockName(), config.getOwnerId(), e);
                throw e;
            }
            state = LockState.HELD;
            startRenewal();
            logger.info("Lock acquired lockName={} ownerId={} timeout={}",
                    config.getLockName(), config.getOwnerId(), config.getTimeout());
        } finally {
            criticalSection.unlock();
        }
    }

    @Override
    public void unlock() throws LockException {
        unlock(config.getOperationTimeout());
    }

    @Override
    public void unlock(Duration timeout) throws LockException {
        enterCriticalSection();
        try {
            stopRenewal();
            if (state != LockState.HELD) {
                logger.debug("Unlock of lock not held by this instance ignored lockName={} state={}",
                        config.getLockName(), state);
                return;
            }
            try {
                invoke(() -> doUnlock(timeout), "unlock");
            } catch (LockNotHeldException e) {
                state = LockState.RELEASED;
                logger.warn("Lock was taken by another owner before release lockName={} ownerId={}",
                        config.getLockName(), config.getOwnerId());
                throw e;
            } catch (LockException e) {
                logger.error("Failed to release lock lockName={} ownerId={}",
                        config.getLockName(), config.getOwnerId(), e);
                throw e;
            }
            state = LockState.RELEASED;
            logger.info("Lock released lockName={} ownerId={}", config.getLockName(), config.getOwnerId());
        } finally {
            criticalSection.unlock();
        }
    }

    @Override
    public void renew() throws LockException {
        renew(config.getOperationTimeout());
    }

    @Override
    public void renew(Duration timeout) throws LockException {
        enterCriticalSection();
        try {
            if (state != LockState.HELD) {
                throw new LockNotHeldException(config.getLockName(),
                        "Lock " + config.getLockName() + " is not held by this instance, state " + state);
            }
            renewHeld(timeout);
        } finally {
            criticalSection.unlock();
        }
    }

    private void renewHeld(Duration timeout) throws LockException {
        state = LockState.RENEWING;
        try {
            invoke(() -> doRenew(timeout), "renew");
            logger.debug("Lock renewed lockName={} ownerId={}", config.getLockName(), config.getOwnerId());
        } finally {
            state = LockState.HELD;
        }
    }

    /**
     * Scheduler tick. Failures are logged and reported to the listener, the instance stays held.
     */
    private void renewOnSchedule(LockRenewalScheduler scheduler) {
        LockException failure = null;
        criticalSection.lock();
        try {
            if (scheduler.isStopped() || state != LockState.HELD) {
                return;
            }
            renewHeld(config.getOperationTimeout());
        } catch (LockException e) {
            logger.error("Failed to renew lock lockName={} ownerId={}", config.getLockName(), config.getOwnerId(), e);
            failure = e;
        } finally {
            criticalSection.unlock();
        }

        if (failure != null) {
            try {
                config.getRenewalFailedListener().onLockRenewalFailed(config.getLockName(), failure);
            } catch (Exception e) {
                logger.error("Failed to invoke LockRenewalFailedListener on lock {}", config.getLockName(), e);
            }
        }
    }

    private void startRenewal() {
        LockRenewalScheduler scheduler = new LockRenewalScheduler(
                config.getLockName(), config.getRenewalInterval(), logger);
        scheduler.start(() -> renewOnSchedule(scheduler));
        renewalScheduler = scheduler;
    }

    private void stopRenewal() {
        LockRenewalScheduler scheduler = renewalScheduler;
        if (scheduler != null) {
            scheduler.stop();
            renewalScheduler = null;
        }
    }

    private void enterCriticalSection() throws LockTransportException {
        try {
            criticalSection.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTransportException(config.getLockName(), "Interrupted while waiting for lock operation", e);
        }
    }

    private void invoke(BackendCall call, String operation) throws LockException {
        try {
            call.run();
        } catch (LockException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LockTransportException(config.getLockName(),
                    "Backend failure on " + operation + " of lock " + config.getLockName(), e);
        }
    }

    @FunctionalInterface
    private interface BackendCall {
        void run() throws LockException;
    }

    /**
     * Waits for a store client future, translating every failure into {@link LockTransportException}.
     */
    protected <T> T await(Future<T> future, Duration timeout, String operation) throws LockTransportException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LockTransportException(config.getLockName(),
                    "Interrupted during " + operation + " of lock " + config.getLockName(), e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new LockTransportException(config.getLockName(),
                    "Timed out after " + timeout + " during " + operation + " of lock " + config.getLockName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new LockTransportException(config.getLockName(),
                    "Failed " + operation + " of lock " + config.getLockName() + ": " + cause.getMessage(), cause);
        }
    }

    @Override
    public LockState getState() {
        return state;
    }

    @Override
    public String getLockName() {
        return config.getLockName();
    }

    @Override
    public String getOwnerId() {
        return config.getOwnerId();
    }

    public LockConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (state != LockState.HELD && state != LockState.RENEWING) {
            criticalSection.lock();
            try {
                stopRenewal();
            } finally {
                criticalSection.unlock();
            }
            return;
        }
        try {
            unlock();
        } catch (LockException e) {
            logger.error("Failed to close lock {}", config.getLockName(), e);
        }
    }
}
