package com.codescout.core.session;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive hold on one session, released on {@link #close()}.
 * Must be closed by the thread that acquired it.
 */
public final class SessionLease implements AutoCloseable {

    private final SessionLockRegistry registry;
    private final SessionKey key;
    final ReentrantLock lock;
    final FileChannel channel;
    final FileLock fileLock;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean discardLockFile;

    SessionLease(SessionLockRegistry registry, SessionKey key, ReentrantLock lock,
                 FileChannel channel, FileLock fileLock) {
        this.registry = registry;
        this.key = key;
        this.lock = lock;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    public SessionKey key() {
        return key;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Deletes the session's lock file on release; used once its record is gone. */
    void discardLockFileOnRelease() {
        discardLockFile = true;
    }

    boolean discardsLockFile() {
        return discardLockFile;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            registry.release(this);
        }
    }
}
