package io.voicecast.application.service;

import io.voicecast.domain.model.NotificationRequest;
import io.voicecast.infrastructure.metrics.NotificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for notification producers and owner of the worker thread.
 *
 * Producers call {@link #submit(String, String)} from any thread; the call returns as soon as
 * the request is queued.
 */
public final class NotificationService {
    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final String WORKER_THREAD_NAME = "voicecast-notify";

    private final NotificationQueue queue;
    private final NotificationWorker worker;
    private final ShutdownCoordinator coordinator;
    private final NotificationMetrics metrics;
    private final String defaultTarget;

    private Thread workerThread;

    public NotificationService(NotificationQueue queue,
                               NotificationWorker worker,
                               ShutdownCoordinator coordinator,
                               NotificationMetrics metrics,
                               String defaultTarget) {
        this.queue = queue;
        this.worker = worker;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.defaultTarget = defaultTarget == null ? "" : defaultTarget.trim();
    }

    public synchronized void start() {
        if (workerThread != null) {
            log.warn("[NotificationService] Worker already running");
            return;
        }
        workerThread = new Thread(worker, WORKER_THREAD_NAME);
        workerThread.setDaemon(true);
        coordinator.setWorkerThread(workerThread);
        workerThread.start();
        log.info("[NotificationService] Notification worker started");
    }

    /**
     * Queue a notification.
     *
     * @return false if the request was rejected (blank text or shutdown in progress)
     */
    public boolean submit(String target, String text) {
        if (target == null || target.isBlank()) {
            log.error("[NotificationService] No target given, notification ignored");
            return false;
        }
        if (text == null || text.isBlank()) {
            log.error("[NotificationService] Empty text for '{}', notification ignored", target);
            return false;
        }
        boolean queued = queue.enqueue(NotificationRequest.of(target.trim(), text.trim()));
        metrics.recordQueueDepth(queue.pendingCount());
        return queued;
    }

    /**
     * Host notification hook: speak {@code text} on the configured default target.
     */
    public boolean notifyDefault(String text) {
        if (defaultTarget.isEmpty()) {
            log.error("[NotificationService] Default voice target not configured, notification ignored");
            return false;
        }
        return submit(defaultTarget, text);
    }

    public String defaultTarget() {
        return defaultTarget;
    }

    public int pendingCount() {
        return queue.pendingCount();
    }

    /**
     * Stop the pipeline. See {@link ShutdownCoordinator#shutdown()}.
     */
    public boolean shutdown() {
        return coordinator.shutdown();
    }
}
