package com.flagship.recycling_ledger.deposit.guard;

import com.flagship.recycling_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    @Test
    @DisplayName("setIfAbsent claims a key once until it expires")
    void setIfAbsent_respectsTtl() {
        assertTrue(store.setIfAbsent("k", "v1", Duration.ofSeconds(60)));
        assertFalse(store.setIfAbsent("k", "v2", Duration.ofSeconds(60)));
        assertEquals("v1", store.get("k").orElseThrow());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(store.get("k").isEmpty(), "Key should expire at its TTL");
        assertTrue(store.setIfAbsent("k", "v3", Duration.ofSeconds(60)));
        assertEquals("v3", store.get("k").orElseThrow());
    }

    @Test
    @DisplayName("incrementBy accumulates and keeps the first expiry")
    void incrementBy_accumulates() {
        assertEquals(500, store.incrementBy("c", 500, Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(5));
        assertEquals(800, store.incrementBy("c", 300, Duration.ofMinutes(10)));
        assertEquals(600, store.incrementBy("c", -200, Duration.ofMinutes(10)));

        clock.advance(Duration.ofMinutes(5));

        assertEquals(100, store.incrementBy("c", 100, Duration.ofMinutes(10)),
            "Counter should restart after the original expiry");
    }

    @Test
    @DisplayName("delete removes a key")
    void delete_removesKey() {
        store.setIfAbsent("k", "v", Duration.ofSeconds(60));
        store.delete("k");

        assertTrue(store.get("k").isEmpty());
        assertTrue(store.setIfAbsent("k", "v", Duration.ofSeconds(60)));
    }

    @Test
    @DisplayName("Concurrent setIfAbsent lets exactly one caller win")
    void setIfAbsent_concurrentCallers() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                start.await();
                if (store.setIfAbsent("race", "x", Duration.ofSeconds(60))) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1, winners.get());
    }
}
