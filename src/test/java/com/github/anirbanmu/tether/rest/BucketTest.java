package com.github.anirbanmu.tether.rest;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BucketTest {

    private static Bucket bucket() {
        return new Bucket("GET/x", "None/None/None/None", Bucket.key("GET/x", "None/None/None/None"));
    }

    @Test
    void readsRateLimitHeaders() {
        Bucket bucket = bucket();
        String disclosed = bucket.update(Responses.json(200, "{}",
            "X-RateLimit-Limit", "5",
            "X-RateLimit-Remaining", "0",
            "X-RateLimit-Reset-After", "1.5",
            "X-RateLimit-Bucket", "abcd"));

        assertEquals("abcd", disclosed);
        assertEquals("abcd", bucket.bucketId());
        assertEquals(5, bucket.limit());
        assertEquals(0, bucket.remaining());
        assertTrue(bucket.exhausted());
        long delayMs = TimeUnit.NANOSECONDS.toMillis(bucket.delayNanos());
        assertTrue(delayMs > 1_000 && delayMs <= 1_500, "delay was " + delayMs);
    }

    @Test
    void bucketIdIsOnlyDisclosedOnce() {
        Bucket bucket = bucket();
        assertEquals("abcd", bucket.update(Responses.json(200, "{}", "X-RateLimit-Bucket", "abcd")));
        assertNull(bucket.update(Responses.json(200, "{}", "X-RateLimit-Bucket", "abcd")));
    }

    @Test
    void fallsBackToEpochReset() {
        Bucket bucket = bucket();
        double resetAt = System.currentTimeMillis() / 1000.0 + 2;
        bucket.update(Responses.json(200, "{}", "X-RateLimit-Remaining", "0", "X-RateLimit-Reset", String.valueOf(resetAt)));

        long delayMs = TimeUnit.NANOSECONDS.toMillis(bucket.delayNanos());
        assertTrue(delayMs > 1_500 && delayMs <= 2_000, "delay was " + delayMs);
    }

    @Test
    void noHeadersMeansNoDelay() {
        Bucket bucket = bucket();
        assertNull(bucket.update(Responses.empty(204)));
        assertFalse(bucket.exhausted());
        assertEquals(0, bucket.delayNanos());
        assertNull(bucket.limit());
    }

    @Test
    void ignoresMalformedHeaders() {
        Bucket bucket = bucket();
        bucket.update(Responses.json(200, "{}", "X-RateLimit-Remaining", "lots", "X-RateLimit-Reset-After", "soon"));
        assertNull(bucket.remaining());
        assertEquals(0, bucket.delayNanos());
    }
}
