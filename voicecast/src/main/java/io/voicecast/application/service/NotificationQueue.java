package io.voicecast.application.service;

import io.voicecast.domain.model.NotificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO hand-off between notification producers and the single worker.
 *
 * Every dequeued item, the shutdown sentinel included, must be acknowledged with
 * {@link #markProcessed()} exactly once. {@link #drain()} waits for the count of
 * unacknowledged items to reach zero.
 */
public final class NotificationQueue {
    private static final Logger log = LoggerFactory.getLogger(NotificationQueue.class);

    private final LinkedBlockingQueue<NotificationRequest> items = new LinkedBlockingQueue<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition allProcessed = lock.newCondition();
    private int unfinished;  // guarded by lock

    private volatile boolean closed = false;  // written under lock

    /**
     * Add a request. Never blocks.
     *
     * @return false if the queue is closed and the request was dropped
     */
    public boolean enqueue(NotificationRequest request) {
        Objects.requireNonNull(request, "request");
        lock.lock();
        try {
            if (closed && !request.isShutdown()) {
                log.warn("[NotificationQueue] Shutting down, notification for '{}' dropped", request.target());
                return false;
            }
            unfinished++;
            items.offer(request);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the oldest request, waiting up to {@code timeoutMs}.
     *
     * @return the request, or null if none arrived in time
     */
    public NotificationRequest dequeue(long timeoutMs) {
        try {
            return items.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    /**
     * Acknowledge one dequeued item.
     *
     * @throws IllegalStateException if called more often than items were enqueued
     */
    public void markProcessed() {
        lock.lock();
        try {
            if (unfinished <= 0) {
                throw new IllegalStateException("markProcessed() called more times than there were items");
            }
            unfinished--;
            if (unfinished == 0) {
                allProcessed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every enqueued item has been marked processed.
     */
    public void drain() throws InterruptedException {
        lock.lock();
        try {
            while (unfinished > 0) {
                allProcessed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Bounded {@link #drain()}.
     *
     * @return true if the queue drained, false on timeout
     */
    public boolean drain(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (unfinished > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = allProcessed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every waiting item and mark each processed without delivering it.
     *
     * @return the discarded items, in queue order
     */
    public List<NotificationRequest> discardPending() {
        List<NotificationRequest> discarded = new ArrayList<>();
        items.drainTo(discarded);
        for (int i = 0; i < discarded.size(); i++) {
            markProcessed();
        }
        return discarded;
    }

    /**
     * Stop accepting new requests. The shutdown sentinel is still accepted.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** Items waiting to be dequeued. */
    public int size() {
        return items.size();
    }

    /** Items enqueued and not yet marked processed, including one in flight. */
    public int pendingCount() {
        lock.lock();
        try {
            return unfinished;
        } finally {
            lock.unlock();
        }
    }
}
