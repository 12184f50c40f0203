package com.github.anirbanmu.tether.gateway;

import com.github.anirbanmu.tether.log.Log;
import java.time.Duration;

// outbound budget for one gateway connection: at most `limit` frames per `window`.
// discord disconnects clients that exceed 120 sends a minute.
public final class ConnectionRateLimiter {
    private final int limit;
    private final long windowNanos;

    private long windowStart;
    private int sent;

    public ConnectionRateLimiter(int limit, Duration window) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.limit = limit;
        this.windowNanos = window.toNanos();
        this.windowStart = System.nanoTime();
    }

    // blocks until a send fits in the current window
    public synchronized void acquire() throws InterruptedException {
        while (true) {
            long now = System.nanoTime();
            if (now - windowStart >= windowNanos) {
                windowStart = now;
                sent = 0;
            }
            if (sent < limit) {
                sent++;
                return;
            }
            long waitNanos = windowStart + windowNanos - now;
            Log.warn("gateway.send_throttled", "wait_ms", waitNanos / 1_000_000);
            wait(Math.max(1, waitNanos / 1_000_000), 0);
        }
    }

    public synchronized int remaining() {
        if (System.nanoTime() - windowStart >= windowNanos) {
            return limit;
        }
        return limit - sent;
    }
}
