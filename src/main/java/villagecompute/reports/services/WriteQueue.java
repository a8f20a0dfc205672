/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jboss.logging.Logger;

import villagecompute.reports.exceptions.WriteQueueClosedException;

/**
 * Serializes every mutation of the report store through one worker thread.
 *
 * <p>
 * The embedded database allows a single writer at a time, so callers never write directly: they {@link #submit} an
 * operation and block until the worker has executed it, receiving its result or its exception. Operations run in
 * submission order.
 *
 * <p>
 * <b>Lifecycle:</b>
 * <ul>
 * <li>{@link #start()} launches the worker thread</li>
 * <li>{@link #shutdown(Duration)} stops accepting new operations, lets the worker drain everything already accepted,
 * then stops it</li>
 * <li>submitting after shutdown began fails with {@link WriteQueueClosedException}, including submitters that were
 * blocked on a full buffer</li>
 * </ul>
 *
 * <p>
 * <b>Thread Safety:</b> {@code closed} only flips under the write lock while submitters enqueue under the read lock,
 * so once the worker observes {@code closed} no further operation can arrive.
 */
public final class WriteQueue {

    private static final Logger LOG = Logger.getLogger(WriteQueue.class);

    private static final long POLL_MILLIS = 100;

    private final String name;
    private final BlockingQueue<WriteOperation<?>> buffer;
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed;
    private Thread worker;

    public WriteQueue(String name, int capacity) {
        this.name = name;
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    public synchronized void start() {
        if (worker != null) {
            return;
        }
        worker = new Thread(this::drainLoop, name);
        worker.setDaemon(true);
        worker.start();
        LOG.infof("Write queue %s started (capacity=%d)", name, buffer.remainingCapacity() + buffer.size());
    }

    /**
     * Enqueues {@code operation} and waits for the worker to execute it.
     *
     * @param description
     *            short operation label for logs, e.g. {@code "updateRun"}
     * @return the operation's result
     * @throws WriteQueueClosedException
     *             if the queue is shut down or the caller is interrupted while waiting
     * @throws RuntimeException
     *             whatever the operation itself threw
     */
    public <T> T submit(String description, Callable<T> operation) {
        WriteOperation<T> op = new WriteOperation<>(description, operation);

        if (Thread.currentThread() == worker) {
            // Nested write from inside an operation: already serialized.
            op.execute();
        } else {
            enqueue(op);
        }

        try {
            return op.result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriteQueueClosedException("Interrupted while awaiting write " + description, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Write " + description + " failed", cause);
        }
    }

    /**
     * Convenience for operations without a result.
     */
    public void execute(String description, Runnable operation) {
        submit(description, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Stops accepting writes and waits up to {@code timeout} for accepted writes to finish. Safe to call repeatedly.
     */
    public void shutdown(Duration timeout) {
        closeLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }

        LOG.infof("Write queue %s shutting down, draining %d pending writes", name, buffer.size());
        Thread current = worker;
        if (current == null) {
            return;
        }
        try {
            current.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.isAlive()) {
            LOG.warnf("Write queue %s did not drain within %s (%d writes left)", name, timeout, buffer.size());
        } else {
            LOG.infof("Write queue %s stopped", name);
        }
    }

    public boolean isAcceptingWrites() {
        return !closed;
    }

    public int pending() {
        return buffer.size();
    }

    private void enqueue(WriteOperation<?> op) {
        while (true) {
            closeLock.readLock().lock();
            try {
                if (closed) {
                    throw new WriteQueueClosedException("Write queue " + name + " is closed, rejected " + op.description);
                }
                if (worker == null) {
                    throw new WriteQueueClosedException("Write queue " + name + " was never started");
                }
                if (buffer.offer(op, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WriteQueueClosedException("Interrupted while enqueuing write " + op.description, e);
            } finally {
                closeLock.readLock().unlock();
            }
            LOG.debugf("Write queue %s full, %s waiting for space", name, op.description);
        }
    }

    private void drainLoop() {
        while (true) {
            WriteOperation<?> op;
            try {
                op = buffer.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                // Only stop once everything accepted has been written.
                if (closed && buffer.isEmpty()) {
                    return;
                }
                continue;
            }
            if (op != null) {
                op.execute();
            } else if (closed && buffer.isEmpty()) {
                return;
            }
        }
    }

    private static final class WriteOperation<T> {

        private final String description;
        private final Callable<T> body;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private WriteOperation(String description, Callable<T> body) {
            this.description = description;
            this.body = body;
        }

        private void execute() {
            try {
                result.complete(body.call());
            } catch (Throwable t) {
                LOG.debugf(t, "Write %s failed", description);
                result.completeExceptionally(t);
            }
        }
    }
}
