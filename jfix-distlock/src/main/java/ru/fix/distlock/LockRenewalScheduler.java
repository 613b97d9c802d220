package ru.fix.distlock;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic renewal task of one held lock. Each held lock owns its own single daemon thread.
 * <p>
 * {@link #stop()} only closes the token and cancels further ticks, it does not wait for a running tick.
 * A tick that already started must check {@link #isStopped()} inside the locker's critical section
 * before touching the backend.
 */
class LockRenewalScheduler {

    private final String lockName;
    private final Duration interval;
    private final Logger logger;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> future;

    LockRenewalScheduler(String lockName, Duration interval, Logger logger) {
        this.lockName = lockName;
        this.interval = interval;
        this.logger = logger;
    }

    synchronized void start(Runnable renewal) {
        if (executor != null) {
            throw new IllegalStateException("Renewal of lock " + lockName + " already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "lock-renewal-" + lockName);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = Math.max(1, interval.toMillis());
        future = executor.scheduleWithFixedDelay(
                () -> {
                    if (stopped.get()) {
                        return;
                    }
                    try {
                        renewal.run();
                    } catch (Exception e) {
                        logger.error("Unexpected failure in renewal task of lockName={}", lockName, e);
                    }
                },
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS
        );
        logger.debug("Renewal started lockName={} interval={}", lockName, interval);
    }

    synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (future != null) {
            future.cancel(false);
        }
        if (executor != null) {
            executor.shutdown();
        }
        logger.debug("Renewal stopped lockName={}", lockName);
    }

    boolean isStopped() {
        return stopped.get();
    }
}
