package com.github.anirbanmu.tether.rest;

import com.github.anirbanmu.tether.ClientClosedException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

// process-wide gate every request passes before it is sent. closed while a global 429 is in force.
public final class GlobalRateLimit {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition opened = lock.newCondition();

    private boolean blocked;
    private long blockedUntil;
    private boolean closed;

    // overlapping blocks keep the later deadline
    public void block(Duration duration) {
        lock.lock();
        try {
            long until = System.nanoTime() + duration.toNanos();
            if (!blocked || until - blockedUntil > 0) {
                blockedUntil = until;
            }
            blocked = true;
        } finally {
            lock.unlock();
        }
    }

    // opens the gate unless a later block is still running
    public void clear() {
        lock.lock();
        try {
            if (blocked && blockedUntil - System.nanoTime() <= 0) {
                blocked = false;
                opened.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isBlocked() {
        lock.lock();
        try {
            return blocked && blockedUntil - System.nanoTime() > 0;
        } finally {
            lock.unlock();
        }
    }

    public void awaitOpen() throws InterruptedException {
        lock.lock();
        try {
            while (blocked && !closed) {
                long wait = blockedUntil - System.nanoTime();
                if (wait <= 0) {
                    blocked = false;
                    opened.signalAll();
                    break;
                }
                opened.await(wait, TimeUnit.NANOSECONDS);
            }
            if (closed) {
                throw new ClientClosedException("REST client is closed");
            }
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
