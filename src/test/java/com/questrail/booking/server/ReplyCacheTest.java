package com.questrail.booking.server;

import com.questrail.booking.model.ClientId;
import com.questrail.booking.model.RequestId;
import com.questrail.booking.time.ManualMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReplyCacheTest {

    private static final ClientId CLIENT = ClientId.random();

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final ReplyCache cache = new ReplyCache(Duration.ofSeconds(20), 3, clock);
    private final AtomicInteger executions = new AtomicInteger();

    private byte[] execute() {
        return new byte[] {(byte) executions.incrementAndGet()};
    }

    @Test
    void duplicateIsAnsweredFromTheFirstExecution() {
        ReplyCache.Resolution first = cache.resolve(RequestId.of(CLIENT, 5), this::execute);
        ReplyCache.Resolution second = cache.resolve(RequestId.of(CLIENT, 5), this::execute);

        assertFalse(first.replayed());
        assertTrue(second.replayed());
        assertArrayEquals(first.reply(), second.reply());
        assertEquals(1, executions.get());
    }

    @Test
    void distinctSequenceNumbersExecuteSeparately() {
        cache.resolve(RequestId.of(CLIENT, 1), this::execute);
        cache.resolve(RequestId.of(CLIENT, 2), this::execute);
        cache.resolve(RequestId.of(ClientId.random(), 1), this::execute);
        assertEquals(3, executions.get());
    }

    @Test
    void entriesExpireAfterRetention() {
        cache.resolve(RequestId.of(CLIENT, 1), this::execute);
        clock.advance(Duration.ofSeconds(19));
        assertTrue(cache.resolve(RequestId.of(CLIENT, 1), this::execute).replayed());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, cache.purgeExpired());
        assertFalse(cache.resolve(RequestId.of(CLIENT, 1), this::execute).replayed());
        assertEquals(2, executions.get());
    }

    @Test
    void capacityEvictsOldestFirst() {
        for (int seq = 1; seq <= 4; seq++) {
            cache.resolve(RequestId.of(CLIENT, seq), this::execute);
        }
        assertEquals(3, cache.size());
        assertTrue(cache.resolve(RequestId.of(CLIENT, 4), this::execute).replayed());
        assertFalse(cache.resolve(RequestId.of(CLIENT, 1), this::execute).replayed());
    }

    @Test
    void capacityEvictionSkipsRunningExecutions() throws Exception {
        RequestId running = RequestId.of(CLIENT, 1);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Void> release = new CompletableFuture<>();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ReplyCache.Resolution> first = pool.submit(() -> cache.resolve(running, () -> {
                started.countDown();
                release.join();
                return execute();
            }));
            assertTrue(started.await(1, TimeUnit.SECONDS));

            for (int seq = 2; seq <= 4; seq++) {
                cache.resolve(RequestId.of(CLIENT, seq), this::execute);
            }
            assertEquals(3, cache.size());

            release.complete(null);
            assertFalse(first.get(1, TimeUnit.SECONDS).replayed());
            assertTrue(cache.resolve(running, this::execute).replayed());
            assertFalse(cache.resolve(RequestId.of(CLIENT, 2), this::execute).replayed());
            assertEquals(5, executions.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedExecutionIsNotRecorded() {
        RequestId id = RequestId.of(CLIENT, 9);
        assertThrows(IllegalStateException.class, () -> cache.resolve(id, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, cache.size());
        assertFalse(cache.resolve(id, this::execute).replayed());
    }

    @Test
    void concurrentDuplicateWaitsForTheRunningExecution() throws Exception {
        RequestId id = RequestId.of(CLIENT, 3);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Void> release = new CompletableFuture<>();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ReplyCache.Resolution> first = pool.submit(() -> cache.resolve(id, () -> {
                started.countDown();
                release.join();
                return execute();
            }));
            assertTrue(started.await(1, TimeUnit.SECONDS));

            Future<ReplyCache.Resolution> second = pool.submit(() -> cache.resolve(id, this::execute));
            Thread.sleep(50);
            assertFalse(second.isDone());

            release.complete(null);
            assertArrayEquals(first.get(1, TimeUnit.SECONDS).reply(), second.get(1, TimeUnit.SECONDS).reply());
            assertTrue(second.get().replayed());
            assertEquals(1, executions.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void disabledCacheExecutesEveryDelivery() {
        ReplyCache disabled = ReplyCache.disabled(clock);
        disabled.resolve(RequestId.of(CLIENT, 5), this::execute);
        assertFalse(disabled.resolve(RequestId.of(CLIENT, 5), this::execute).replayed());
        assertEquals(2, executions.get());
    }
}
