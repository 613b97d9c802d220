package ru.fix.distlock;

import org.junit.jupiter.api.Test;
import ru.fix.distlock.memory.InMemoryLockStore;
import ru.fix.distlock.memory.InMemoryLocker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LockTemplateTest {

    private final InMemoryLockStore store = new InMemoryLockStore();

    @Test
    public void tryLockAcquiresFreeLock() throws Exception {
        try (Locker locker = locker("owner-a")) {
            assertTrue(new LockTemplate(Duration.ZERO).tryLock(locker));
            assertEquals(LockState.HELD, locker.getState());
        }
    }

    @Test
    public void tryLockGivesUpAfterAcquiringTimeout() throws Exception {
        try (Locker holder = locker("owner-a"); Locker contender = locker("owner-b")) {
            holder.lock();

            long start = System.nanoTime();
            boolean acquired = new LockTemplate(Duration.ofMillis(300), Duration.ofMillis(50)).tryLock(contender);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertFalse(acquired);
            assertTrue(elapsedMs >= 300, "gave up after " + elapsedMs + " ms");
            assertEquals(LockState.IDLE, contender.getState());
        }
    }

    @Test
    public void tryLockWaitsUntilHolderReleases() throws Exception {
        try (Locker holder = locker("owner-a"); Locker contender = locker("owner-b")) {
            holder.lock();
            CompletableFuture<Void> release = CompletableFuture.runAsync(() -> {
                try {
                    Thread.sleep(200);
                    holder.unlock();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });

            assertTrue(new LockTemplate(Duration.ofSeconds(10), Duration.ofMillis(20)).tryLock(contender));
            release.get(10, TimeUnit.SECONDS);
            assertEquals(LockState.HELD, contender.getState());
        }
    }

    @Test
    public void executeWithLockReleasesAfterAction() throws Exception {
        try (Locker locker = locker("owner-a")) {
            String result = new LockTemplate(Duration.ofSeconds(1)).executeWithLock(locker, () -> {
                assertEquals(LockState.HELD, locker.getState());
                return "done";
            });

            assertEquals("done", result);
            assertEquals(LockState.RELEASED, locker.getState());
            assertFalse(store.find("report").isPresent());
        }
    }

    @Test
    public void executeWithLockReleasesWhenActionFails() throws Exception {
        try (Locker locker = locker("owner-a")) {
            assertThrows(IllegalArgumentException.class,
                    () -> new LockTemplate(Duration.ofSeconds(1)).executeWithLock(locker, () -> {
                        throw new IllegalArgumentException("bad input");
                    }));

            assertEquals(LockState.RELEASED, locker.getState());
            assertFalse(store.find("report").isPresent());
        }
    }

    @Test
    public void executeWithLockRethrowsLastConflict() throws Exception {
        try (Locker holder = locker("owner-a"); Locker contender = locker("owner-b")) {
            holder.lock();

            LockAcquisitionConflictException e = assertThrows(LockAcquisitionConflictException.class,
                    () -> new LockTemplate(Duration.ofMillis(100), Duration.ofMillis(20))
                            .executeWithLock(contender, () -> "never"));

            assertEquals("owner-a", e.getCurrentOwner());
        }
    }

    @Test
    public void invalidIntervalsAreRejected() {
        assertThrows(LockConfigurationException.class, () -> new LockTemplate(Duration.ofSeconds(-1)));
        assertThrows(LockConfigurationException.class, () -> new LockTemplate(Duration.ofSeconds(1), Duration.ZERO));
    }

    private Locker locker(String ownerId) {
        return new InMemoryLocker(store, LockConfig.builder()
                .lockName("report")
                .ownerId(ownerId)
                .timeout(Duration.ofMinutes(1))
                .build());
    }
}
