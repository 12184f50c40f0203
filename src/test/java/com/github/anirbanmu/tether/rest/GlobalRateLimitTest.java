package com.github.anirbanmu.tether.rest;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.tether.ClientClosedException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class GlobalRateLimitTest {

    @Test
    void openGateDoesNotWait() throws Exception {
        GlobalRateLimit gate = new GlobalRateLimit();
        long start = System.nanoTime();
        gate.awaitOpen();
        assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(100));
        assertFalse(gate.isBlocked());
    }

    @Test
    void blockedGateWaitsForDeadline() throws Exception {
        GlobalRateLimit gate = new GlobalRateLimit();
        gate.block(Duration.ofMillis(200));
        assertTrue(gate.isBlocked());

        long start = System.nanoTime();
        gate.awaitOpen();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(elapsedMs >= 180, "waited " + elapsedMs + "ms");
        assertFalse(gate.isBlocked());
    }

    @Test
    void earlyClearKeepsLaterDeadline() {
        GlobalRateLimit gate = new GlobalRateLimit();
        gate.block(Duration.ofMillis(50));
        gate.block(Duration.ofSeconds(5));
        gate.clear();
        assertTrue(gate.isBlocked());
    }

    @Test
    void closeWakesWaiters() throws Exception {
        GlobalRateLimit gate = new GlobalRateLimit();
        gate.block(Duration.ofSeconds(30));
        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                gate.awaitOpen();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        gate.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ClientClosedException.class, e.getCause());
    }
}
