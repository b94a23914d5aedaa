package io.voicecast.application.service;

import io.voicecast.application.exception.NotificationException;
import io.voicecast.application.exception.PlaybackTimeoutException;
import io.voicecast.application.exception.TargetNotFoundException;
import io.voicecast.application.exception.TargetUnavailableException;
import io.voicecast.application.port.output.Endpoint;
import io.voicecast.domain.model.AudioAsset;
import io.voicecast.domain.model.EndpointStatus;
import io.voicecast.domain.model.NotificationRequest;
import io.voicecast.domain.model.PlaybackResult;
import io.voicecast.domain.model.RestoreOutcome;
import io.voicecast.domain.model.SessionOutcome;
import io.voicecast.domain.model.TargetStateSnapshot;
import io.voicecast.infrastructure.metrics.NotificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Single consumer of the {@link NotificationQueue}.
 *
 * Sessions run one at a time, in queue order:
 * <pre>
 * RESOLVE_TARGET → CHECK_MUTE → SYNTHESIZE → CHECK_ASSET_EXISTS → SNAPSHOT_STATE
 *   → PLAY → AWAIT_ACTIVE → DETECT_COMPLETION → RESTORE_STATE → CLEANUP
 * </pre>
 * A failed session is logged and the worker moves to the next request; nothing is retried.
 * Once the {@link ShutdownSignal} fires the current session is abandoned (restore is still
 * attempted once), the loop ends and whatever is left in the queue is discarded.
 */
public final class NotificationWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(NotificationWorker.class);

    static final long DEQUEUE_TIMEOUT_MS = 1000;

    private final NotificationQueue queue;
    private final TargetDirectory targets;
    private final AudioAssetGenerator assets;
    private final TargetStateManager stateManager;
    private final PlaybackCompletionDetector detector;
    private final ShutdownSignal signal;
    private final String mediaBaseUrl;
    private final NotificationMetrics metrics;

    /**
     * @param mediaBaseUrl base URL of the media server as seen by targets, e.g. {@code http://192.168.1.10:15555}
     */
    public NotificationWorker(NotificationQueue queue,
                              TargetDirectory targets,
                              AudioAssetGenerator assets,
                              TargetStateManager stateManager,
                              PlaybackCompletionDetector detector,
                              ShutdownSignal signal,
                              String mediaBaseUrl,
                              NotificationMetrics metrics) {
        this.queue = queue;
        this.targets = targets;
        this.assets = assets;
        this.stateManager = stateManager;
        this.detector = detector;
        this.signal = signal;
        this.mediaBaseUrl = stripTrailingSlash(mediaBaseUrl);
        this.metrics = metrics;
    }

    @Override
    public void run() {
        log.debug("[Worker] Entering notification handler");

        while (!signal.isTriggered()) {
            NotificationRequest request = queue.dequeue(DEQUEUE_TIMEOUT_MS);
            if (request == null) {
                continue;
            }
            try {
                if (request.isShutdown()) {
                    log.debug("[Worker] Shutdown sentinel received");
                    break;
                }
                process(request);
            } catch (RuntimeException e) {
                log.error("[Worker] Unexpected failure handling notification for '{}'", request.target(), e);
            } finally {
                queue.markProcessed();
                metrics.recordQueueDepth(queue.pendingCount());
            }
        }

        List<NotificationRequest> dropped = queue.discardPending();
        for (NotificationRequest request : dropped) {
            if (!request.isShutdown()) {
                log.warn("[Worker] Notification for '{}' dropped at shutdown: '{}'", request.target(), request.text());
            }
        }
        metrics.recordQueueDepth(queue.pendingCount());
        log.debug("[Worker] Exiting notification handler");
    }

    /**
     * Run one session to a terminal state. Never throws for per-request failures.
     */
    public SessionOutcome process(NotificationRequest request) {
        long startedAt = System.nanoTime();
        SessionOutcome outcome;
        try {
            outcome = deliver(request);
        } catch (NotificationException e) {
            log.error("[Worker] Notification failed: {}", e.getMessage());
            outcome = e.outcome();
        } catch (RuntimeException e) {
            log.error("[Worker] Notification to '{}' failed", request.target(), e);
            outcome = SessionOutcome.FAILED;
        }
        metrics.recordSession(outcome, Duration.ofNanos(System.nanoTime() - startedAt));
        return outcome;
    }

    private SessionOutcome deliver(NotificationRequest request) {
        log.debug("[Worker] '{}', to be sent to '{}'", request.text(), request.target());

        // RESOLVE_TARGET
        Endpoint target = targets.findByName(request.target())
            .orElseThrow(() -> new TargetNotFoundException(request.target()));

        // CHECK_MUTE
        EndpointStatus status = target.status();
        if (status != null && status.isMuted()) {
            log.info("[Worker] Device '{}' is muted, notification skipped", target.name());
            return SessionOutcome.SKIPPED_MUTED;
        }
        if (!target.isReady()) {
            throw new TargetUnavailableException(target.name());
        }

        // SYNTHESIZE, CHECK_ASSET_EXISTS
        AudioAsset asset = assets.generate(target.name(), target.id(), request.text());
        if (signal.isTriggered()) {
            assets.delete(asset);
            return SessionOutcome.CANCELLED;
        }

        // SNAPSHOT_STATE .. RESTORE_STATE, CLEANUP
        boolean keepAsset = false;
        try {
            TargetStateSnapshot snapshot = stateManager.snapshot(target);
            PlaybackResult result;
            try {
                result = detector.play(target.mediaSession(), mediaUrl(asset), asset, signal);
            } finally {
                RestoreOutcome restored = stateManager.restore(target, snapshot, signal);
                log.debug("[Worker] '{}' restore: {}", target.name(), restored);
            }

            if (result.completed()) {
                log.info("[Worker] Notification sent to '{}' completed in {}ms", target.name(), result.elapsed().toMillis());
                return SessionOutcome.COMPLETED;
            }
            if (result.cancelled()) {
                log.info("[Worker] Notification to '{}' interrupted by shutdown", target.name());
                return SessionOutcome.CANCELLED;
            }
            // timed-out asset stays on disk for inspection
            keepAsset = true;
            throw new PlaybackTimeoutException(target.name(), asset.path(), result.sawPlaying());
        } finally {
            if (!keepAsset) {
                assets.delete(asset);
            }
        }
    }

    /**
     * URL the target fetches the asset from. The query parameter defeats receiver-side caching
     * when the same file name is reused for the next notification.
     */
    String mediaUrl(AudioAsset asset) {
        return mediaBaseUrl + "/" + asset.fileName() + "?t=" + System.currentTimeMillis();
    }

    private static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
