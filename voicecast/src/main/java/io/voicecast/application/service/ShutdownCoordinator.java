package io.voicecast.application.service;

import io.voicecast.domain.model.NotificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded stop sequence for the notification pipeline.
 *
 * <ol>
 *   <li>set the shutdown signal and close the queue to new requests</li>
 *   <li>push the sentinel so a worker blocked on an empty queue wakes up</li>
 *   <li>join the worker thread, up to the timeout</li>
 *   <li>wait for the queue to drain, up to the timeout</li>
 *   <li>stop the registered resources (media server, API, targets) in registration order</li>
 * </ol>
 * A step that overruns its bound is logged as an error and the sequence continues.
 */
public final class ShutdownCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

    private final ShutdownSignal signal;
    private final NotificationQueue queue;
    private final Duration timeout;
    private final Map<String, Runnable> resources = new LinkedHashMap<>();
    private volatile Thread workerThread;

    public ShutdownCoordinator(ShutdownSignal signal, NotificationQueue queue, Duration timeout) {
        this.signal = signal;
        this.queue = queue;
        this.timeout = timeout;
    }

    public void setWorkerThread(Thread workerThread) {
        this.workerThread = workerThread;
    }

    /**
     * Register something to stop after the worker is done. Stopped in registration order.
     */
    public synchronized void register(String name, Runnable stopAction) {
        resources.put(name, stopAction);
    }

    /**
     * Run the stop sequence. Only the first call has any effect.
     *
     * @return true if the worker stopped and the queue drained within the bound
     */
    public boolean shutdown() {
        if (!signal.trigger()) {
            log.debug("[Shutdown] Already requested");
            return true;
        }

        boolean clean = true;
        queue.close();
        log.info("[Shutdown] Clearing notification queue (approximate size {} entries)...", queue.size());
        queue.enqueue(NotificationRequest.SHUTDOWN);

        Thread worker = workerThread;
        if (worker != null && worker.isAlive()) {
            try {
                worker.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (worker.isAlive()) {
                log.error("[Shutdown] '{}' thread did not stop within {}s", worker.getName(), timeout.toSeconds());
                clean = false;
            }
        }
        if (worker == null || !worker.isAlive()) {
            // The worker may have exited before the sentinel landed; nobody else will acknowledge it.
            for (NotificationRequest leftover : queue.discardPending()) {
                if (!leftover.isShutdown()) {
                    log.warn("[Shutdown] Notification for '{}' dropped", leftover.target());
                }
            }
        }

        log.info("[Shutdown] Waiting for notification queue to drain...");
        try {
            if (!queue.drain(timeout)) {
                log.error("[Shutdown] Notification queue still has {} unprocessed entries after {}s",
                    queue.pendingCount(), timeout.toSeconds());
                clean = false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }

        Map<String, Runnable> toStop;
        synchronized (this) {
            toStop = new LinkedHashMap<>(resources);
        }
        for (Map.Entry<String, Runnable> entry : toStop.entrySet()) {
            try {
                log.info("[Shutdown] Stopping {}...", entry.getKey());
                entry.getValue().run();
            } catch (RuntimeException e) {
                log.error("[Shutdown] Failed to stop {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }

        if (clean) {
            log.info("[Shutdown] All threads stopped");
        }
        return clean;
    }
}
