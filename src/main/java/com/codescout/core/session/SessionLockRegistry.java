package com.codescout.core.session;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Grants exclusive leases on sessions.
 * <p>
 * Within the process a {@link ReentrantLock} per session serialises reviews;
 * across processes an OS file lock on a sibling {@code .lock} file does the same.
 * A thread that already holds a lease on a session cannot take a second one.
 */
public class SessionLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionLockRegistry.class);
    private static final long FILE_LOCK_POLL_MILLIS = 25;

    private final Path lockDirectory;
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<SessionLease> active = ConcurrentHashMap.newKeySet();

    public SessionLockRegistry(Path lockDirectory) {
        this.lockDirectory = lockDirectory;
    }

    /**
     * @param wait how long to wait for a busy session; zero fails immediately
     * @throws SessionBusyException if the session stays busy for the whole wait
     */
    public SessionLease acquire(SessionKey key, Duration wait) {
        String digest = key.digest();
        long deadline = System.nanoTime() + wait.toNanos();
        ReentrantLock lock = lockFor(key, digest, deadline);

        FileChannel channel = null;
        try {
            Files.createDirectories(lockDirectory);
            channel = FileChannel.open(lockFile(digest), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = tryFileLock(channel, deadline);
            if (fileLock == null) {
                throw new SessionBusyException("Session '" + key.name() + "' is in use by another process");
            }
            SessionLease lease = new SessionLease(this, key, lock, channel, fileLock);
            active.add(lease);
            log.debug("Leased session {}", key.name());
            return lease;
        } catch (IOException e) {
            closeQuietly(channel);
            unlock(digest, lock);
            throw new UncheckedIOException("Cannot lock session '" + key.name() + "'", e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            unlock(digest, lock);
            throw e;
        }
    }

    /**
     * Locks the registered lock of a session. An entry dropped by a concurrent
     * release while this thread waited is retried against the fresh entry.
     */
    private ReentrantLock lockFor(SessionKey key, String digest, long deadline) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(digest, d -> new ReentrantLock());
            if (lock.isHeldByCurrentThread()) {
                throw new SessionBusyException("Session '" + key.name() + "' is already leased by this review");
            }
            try {
                if (!lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                    throw new SessionBusyException("Session '" + key.name() + "' is in use by another review");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionBusyException("Interrupted while waiting for session '" + key.name() + "'");
            }
            if (locks.get(digest) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    void release(SessionLease lease) {
        active.remove(lease);
        String digest = lease.key().digest();
        try {
            if (lease.fileLock.isValid()) {
                lease.fileLock.release();
            }
            lease.channel.close();
            if (lease.discardsLockFile()) {
                Files.deleteIfExists(lockFile(digest));
            }
        } catch (IOException e) {
            log.warn("Failed to release file lock for session {}: {}", lease.key().name(), e.getMessage());
        } finally {
            if (lease.lock.isHeldByCurrentThread()) {
                unlock(digest, lease.lock);
            }
        }
        log.debug("Released session {}", lease.key().name());
    }

    // Drops the entry while still holding the lock unless another thread is queued on it
    private void unlock(String digest, ReentrantLock lock) {
        locks.computeIfPresent(digest, (d, current) -> current == lock && !lock.hasQueuedThreads() ? null : current);
        lock.unlock();
    }

    int trackedLocks() {
        return locks.size();
    }

    public int activeCount() {
        return active.size();
    }

    public Set<SessionKey> activeSessions() {
        return active.stream().map(SessionLease::key).collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Drops the OS file locks of leases still open at shutdown.
     */
    @PreDestroy
    public void shutdown() {
        if (!active.isEmpty()) {
            log.warn("Shutting down with {} active session lease(s)", active.size());
        }
        for (SessionLease lease : active) {
            closeQuietly(lease.channel);
        }
        active.clear();
    }

    private Path lockFile(String digest) {
        return lockDirectory.resolve(digest + ".lock");
    }

    private static FileLock tryFileLock(FileChannel channel, long deadline) throws IOException {
        while (true) {
            try {
                FileLock fileLock = channel.tryLock();
                if (fileLock != null) {
                    return fileLock;
                }
            } catch (OverlappingFileLockException e) {
                log.debug("Lock file already held inside this JVM");
            }
            if (System.nanoTime() >= deadline) {
                return null;
            }
            try {
                Thread.sleep(FILE_LOCK_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel: {}", e.getMessage());
        }
    }
}
