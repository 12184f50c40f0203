package com.github.anirbanmu.tether.rest;

import java.util.concurrent.Semaphore;

// rate-limit state for one bucket key plus the lock that serializes requests on it.
// the lock is a fair single-permit semaphore: deferred releases come from the timer thread
public final class Bucket {
    private static final String SEPARATOR = "___";

    private final String routeKey;
    private final String majorKey;
    private final Semaphore lock = new Semaphore(1, true);

    // rate-limit fields, guarded by this
    private String key;
    private String bucketId;
    private Integer limit;
    private Integer remaining;
    private long resetAtNanos;
    private boolean resetKnown;
    private boolean retired;

    // callers between resolve and release, guarded by the owning BucketRegistry
    int pending;

    Bucket(String routeKey, String majorKey, String key) {
        this.routeKey = routeKey;
        this.majorKey = majorKey;
        this.key = key;
    }

    static String key(String bucketOrRouteKey, String majorKey) {
        return bucketOrRouteKey + SEPARATOR + majorKey;
    }

    public String routeKey() {
        return routeKey;
    }

    public String majorKey() {
        return majorKey;
    }

    public synchronized String key() {
        return key;
    }

    public synchronized String bucketId() {
        return bucketId;
    }

    public synchronized Integer limit() {
        return limit;
    }

    public synchronized Integer remaining() {
        return remaining;
    }

    void acquire() throws InterruptedException {
        lock.acquire();
    }

    void unlock() {
        lock.release();
    }

    // lets every waiter through; only used when the executor shuts down
    void abandon() {
        lock.release(lock.getQueueLength() + 1);
    }

    synchronized void rekey(String newKey) {
        key = newKey;
    }

    // another bucket already owns this one's real key; queued callers must move over
    synchronized void retire() {
        retired = true;
    }

    synchronized boolean retired() {
        return retired;
    }

    // applies the X-RateLimit-* headers; returns the bucket id the first time one is disclosed
    synchronized String update(RestResponse response) {
        long now = System.nanoTime();
        Integer parsedLimit = parseInt(response.header("X-RateLimit-Limit"));
        if (parsedLimit != null) {
            limit = parsedLimit;
        }
        Integer parsedRemaining = parseInt(response.header("X-RateLimit-Remaining"));
        if (parsedRemaining != null) {
            remaining = parsedRemaining;
        }

        Double resetAfter = parseDouble(response.header("X-RateLimit-Reset-After"));
        if (resetAfter != null) {
            resetAtNanos = now + (long) (resetAfter * 1_000_000_000L);
            resetKnown = true;
        } else {
            Double resetEpoch = parseDouble(response.header("X-RateLimit-Reset"));
            if (resetEpoch != null) {
                double secondsLeft = resetEpoch - System.currentTimeMillis() / 1000.0;
                resetAtNanos = now + (long) (Math.max(0, secondsLeft) * 1_000_000_000L);
                resetKnown = true;
            }
        }

        String disclosed = response.header("X-RateLimit-Bucket");
        if (disclosed != null && !disclosed.isEmpty() && bucketId == null) {
            bucketId = disclosed;
            return disclosed;
        }
        return null;
    }

    synchronized boolean exhausted() {
        return remaining != null && remaining == 0;
    }

    // nanos until the current window resets, 0 when unknown or already past
    synchronized long delayNanos() {
        if (!resetKnown) {
            return 0;
        }
        return Math.max(0, resetAtNanos - System.nanoTime());
    }

    private static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public synchronized String toString() {
        return "Bucket[" + key + ", remaining=" + remaining + "/" + limit + "]";
    }
}
