package com.tonyguerra.net.pgwire.core;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handshake between synchronous socket readers and the notification thread.
 *
 * A caller obtains a {@link Block} before reading the socket; {@link #block()} returns only
 * once the notification thread is parked outside its read section, and the thread stays
 * parked until every block is closed. Blocks nest, so a caller already holding one may take
 * another.
 */
public final class NotificationGate {
    private final ReentrantLock lock;
    private final Condition changed;

    // Runs on the releasing thread once the last block is closed
    private final Runnable onReleased;

    private int blockers;
    private boolean listenerReading;
    private boolean shutdown;

    public NotificationGate() {
        this(() -> {
        });
    }

    public NotificationGate(Runnable onReleased) {
        this.lock = new ReentrantLock();
        this.changed = lock.newCondition();
        this.onReleased = onReleased;
    }

    /**
     * Suspends the notification thread. Blocks until it has left its read section.
     */
    public Block block() {
        lock.lock();
        try {
            blockers++;
            boolean interrupted = false;
            while (listenerReading) {
                try {
                    changed.await();
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return new Block();
        } finally {
            lock.unlock();
        }
    }

    public boolean isBlocked() {
        lock.lock();
        try {
            return blockers > 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Called by the notification thread before it touches the socket.
     *
     * @param maxWaitMs how long to wait for blockers to go away
     * @return true if the thread may read now and must call {@link #exitRead()} afterwards
     */
    boolean enterRead(long maxWaitMs) throws InterruptedException {
        lock.lock();
        try {
            long nanos = TimeUnit.MILLISECONDS.toNanos(maxWaitMs);
            while (blockers > 0 && !shutdown) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            if (shutdown) {
                return false;
            }
            listenerReading = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void exitRead() {
        lock.lock();
        try {
            listenerReading = false;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Parks the notification thread for up to {@code ms}, waking early on shutdown. */
    void idle(long ms) throws InterruptedException {
        lock.lock();
        try {
            if (!shutdown) {
                changed.await(ms, TimeUnit.MILLISECONDS);
            }
        } finally {
            lock.unlock();
        }
    }

    void reopen() {
        lock.lock();
        try {
            shutdown = false;
        } finally {
            lock.unlock();
        }
    }

    void shutdown() {
        lock.lock();
        try {
            shutdown = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        final boolean last;
        lock.lock();
        try {
            blockers--;
            last = blockers == 0;
            changed.signalAll();
        } finally {
            lock.unlock();
        }

        if (last) {
            onReleased.run();
        }
    }

    /**
     * Scoped suspension of the notification thread; use with try-with-resources.
     */
    public final class Block implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Block() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
