package com.codescout.core.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionLockRegistryTest {

    @TempDir
    Path tempDir;

    private SessionLockRegistry registry;
    private final SessionKey key = new SessionKey("main", "/work/app");

    @BeforeEach
    void setUp() {
        registry = new SessionLockRegistry(tempDir);
    }

    @Test
    @DisplayName("a leased session is busy for other reviews until released")
    void busyUntilReleased() throws Exception {
        SessionLease lease = registry.acquire(key, Duration.ZERO);
        assertEquals(1, registry.activeCount());
        assertTrue(registry.activeSessions().contains(key));

        ExecutionException busy = assertThrows(ExecutionException.class, () -> CompletableFuture
                .supplyAsync(() -> registry.acquire(key, Duration.ofMillis(50)))
                .get(5, TimeUnit.SECONDS));
        assertInstanceOf(SessionBusyException.class, busy.getCause());

        lease.close();
        assertTrue(lease.isReleased());
        assertEquals(0, registry.activeCount());

        SessionLease other = CompletableFuture
                .supplyAsync(() -> {
                    SessionLease l = registry.acquire(key, Duration.ofMillis(50));
                    l.close();
                    return l;
                })
                .get(5, TimeUnit.SECONDS);
        assertTrue(other.isReleased());
    }

    @Test
    @DisplayName("the holding thread cannot lease the same session twice")
    void noReentrantLease() {
        try (SessionLease lease = registry.acquire(key, Duration.ZERO)) {
            SessionBusyException e = assertThrows(SessionBusyException.class,
                    () -> registry.acquire(key, Duration.ZERO));
            assertEquals("session_busy", e.kind());
            assertFalse(lease.isReleased());
        }
        assertEquals(0, registry.activeCount());
    }

    @Test
    @DisplayName("different sessions lease independently")
    void independentSessions() {
        try (SessionLease a = registry.acquire(key, Duration.ZERO);
             SessionLease b = registry.acquire(new SessionKey("main", "/work/other"), Duration.ZERO)) {
            assertEquals(2, registry.activeCount());
            assertNotEquals(a.key(), b.key());
        }
    }

    @Test
    @DisplayName("closing a lease twice is harmless")
    void doubleClose() {
        SessionLease lease = registry.acquire(key, Duration.ZERO);
        lease.close();
        lease.close();
        assertEquals(0, registry.activeCount());
    }

    @Test
    @DisplayName("released sessions leave no lock entry behind")
    void releasedEntriesAreDropped() {
        for (int i = 0; i < 5; i++) {
            registry.acquire(new SessionKey("REV-" + i, "/work/app"), Duration.ZERO).close();
        }
        assertEquals(0, registry.trackedLocks());
        assertEquals(0, registry.activeCount());
    }

    @Test
    @DisplayName("a waiting review gets the session once the holder releases it")
    void waiterAcquiresAfterRelease() throws Exception {
        SessionLease lease = registry.acquire(key, Duration.ZERO);
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try (SessionLease next = registry.acquire(key, Duration.ofSeconds(5))) {
                return !next.isReleased();
            }
        });
        Thread.sleep(100);

        lease.close();

        assertTrue(waiter.get(5, TimeUnit.SECONDS));
        assertEquals(0, registry.trackedLocks());
    }

    @Test
    @DisplayName("a lease marked for discard removes its lock file")
    void discardsLockFile() {
        Path lockFile = tempDir.resolve(key.digest() + ".lock");
        SessionLease lease = registry.acquire(key, Duration.ZERO);
        assertTrue(Files.exists(lockFile));

        lease.discardLockFileOnRelease();
        lease.close();

        assertFalse(Files.exists(lockFile));
    }
}
