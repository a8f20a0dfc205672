/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.reports.exceptions.WriteQueueClosedException;

/**
 * Unit tests for {@link WriteQueue}.
 */
class WriteQueueTest {

    private WriteQueue queue;
    private ExecutorService submitters;

    @BeforeEach
    void setUp() {
        queue = new WriteQueue("test-writer", 4);
        submitters = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        queue.shutdown(Duration.ofSeconds(5));
        submitters.shutdownNow();
    }

    @Test
    void testSubmit_returnsOperationResult() {
        queue.start();

        assertEquals(42, queue.submit("answer", () -> 42));
    }

    @Test
    void testConcurrentSubmissionsNeverOverlap() throws Exception {
        queue.start();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(submitters.submit(() -> queue.execute("write", () -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                active.decrementAndGet();
                completed.incrementAndGet();
            })));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertEquals(50, completed.get());
        assertEquals(1, maxActive.get());
    }

    @Test
    void testOperationRuntimeExceptionReachesSubmitter() {
        queue.start();
        IllegalArgumentException failure = new IllegalArgumentException("constraint violated");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> queue.submit("bad", () -> {
                    throw failure;
                }));
        assertSame(failure, thrown);
    }

    @Test
    void testCheckedExceptionIsWrapped() {
        queue.start();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> queue.submit("io", () -> {
            throw new IOException("disk full");
        }));
        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void testNestedSubmitRunsInline() {
        queue.start();

        int result = queue.submit("outer", () -> queue.submit("inner", () -> 7) + 1);

        assertEquals(8, result);
    }

    @Test
    void testSubmitBeforeStartIsRejected() {
        assertThrows(WriteQueueClosedException.class, () -> queue.submit("early", () -> 1));
    }

    @Test
    void testShutdownDrainsAcceptedWritesAndRejectsNewOnes() throws Exception {
        queue.start();
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger written = new AtomicInteger();

        CountDownLatch blocking = new CountDownLatch(1);
        Future<?> blocker = submitters.submit(() -> queue.execute("blocker", () -> {
            blocking.countDown();
            await(gate);
        }));
        assertTrue(blocking.await(10, TimeUnit.SECONDS));
        Future<?> first = submitters.submit(() -> queue.execute("first", written::incrementAndGet));
        Future<?> second = submitters.submit(() -> queue.execute("second", written::incrementAndGet));
        waitFor(() -> queue.pending() == 2);

        CompletableFuture<Void> shutdown = CompletableFuture.runAsync(() -> queue.shutdown(Duration.ofSeconds(10)));
        waitFor(() -> !queue.isAcceptingWrites());

        assertThrows(WriteQueueClosedException.class, () -> queue.submit("late", () -> 1));

        gate.countDown();
        shutdown.get(10, TimeUnit.SECONDS);
        blocker.get(1, TimeUnit.SECONDS);
        first.get(1, TimeUnit.SECONDS);
        second.get(1, TimeUnit.SECONDS);
        assertEquals(2, written.get());
    }

    @Test
    void testSubmitterBlockedOnFullBufferIsRejectedAtShutdown() throws Exception {
        WriteQueue small = new WriteQueue("small-writer", 1);
        small.start();
        CountDownLatch gate = new CountDownLatch(1);
        try {
            CountDownLatch blocking = new CountDownLatch(1);
            submitters.submit(() -> small.execute("blocker", () -> {
                blocking.countDown();
                await(gate);
            }));
            assertTrue(blocking.await(10, TimeUnit.SECONDS));
            submitters.submit(() -> small.execute("buffered", () -> {
            }));
            waitFor(() -> small.pending() == 1);
            Future<?> waiting = submitters.submit(() -> small.execute("waiting", () -> {
            }));

            CompletableFuture<Void> shutdown = CompletableFuture
                    .runAsync(() -> small.shutdown(Duration.ofSeconds(10)));

            ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(10, TimeUnit.SECONDS));
            assertInstanceOf(WriteQueueClosedException.class, e.getCause());

            gate.countDown();
            shutdown.get(10, TimeUnit.SECONDS);
            assertFalse(small.isAcceptingWrites());
        } finally {
            gate.countDown();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(10, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 10s");
            }
            Thread.sleep(10);
        }
    }
}
