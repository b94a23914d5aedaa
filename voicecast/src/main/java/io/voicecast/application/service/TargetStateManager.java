package io.voicecast.application.service;

import io.voicecast.application.port.output.Endpoint;
import io.voicecast.domain.model.EndpointStatus;
import io.voicecast.domain.model.PlaybackStatus;
import io.voicecast.domain.model.RestoreOutcome;
import io.voicecast.domain.model.TargetStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Saves a target's volume, mute and running app before a notification and puts them back after.
 *
 * Restore waits for the target to report ready again, because receivers often drop their
 * connection when the notification media finishes. If it never comes back, nothing is
 * applied: a half-restored target is worse than an untouched one.
 */
public final class TargetStateManager {
    private static final Logger log = LoggerFactory.getLogger(TargetStateManager.class);

    public static final Duration DEFAULT_READY_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_READY_ATTEMPTS = 10;

    private final double notificationVolume;
    private final Duration readyPollInterval;
    private final int readyAttempts;

    /**
     * @param notificationVolume volume applied while the notification plays, 0.0 to 1.0
     */
    public TargetStateManager(double notificationVolume) {
        this(notificationVolume, DEFAULT_READY_POLL_INTERVAL, DEFAULT_READY_ATTEMPTS);
    }

    public TargetStateManager(double notificationVolume, Duration readyPollInterval, int readyAttempts) {
        if (notificationVolume < 0.0 || notificationVolume > 1.0) {
            throw new IllegalArgumentException("notification volume must be within [0, 1]: " + notificationVolume);
        }
        this.notificationVolume = notificationVolume;
        this.readyPollInterval = readyPollInterval;
        this.readyAttempts = readyAttempts;
    }

    /**
     * Capture the current state, then stop any app, set the notification volume and unmute.
     *
     * @return the captured state; {@link TargetStateSnapshot#EMPTY} if the target had not reported any
     */
    public TargetStateSnapshot snapshot(Endpoint target) {
        TargetStateSnapshot snapshot = capture(target);
        log.debug("[TargetStateManager] '{}' state saved: {}", target.name(), snapshot);

        try {
            target.stopApp();
        } catch (RuntimeException e) {
            log.warn("[TargetStateManager] '{}' failed to quit app: {}", target.name(), e.getMessage());
        }
        try {
            target.setVolume(notificationVolume);
            target.setMuted(false);
        } catch (RuntimeException e) {
            log.warn("[TargetStateManager] '{}' failed to set notification volume: {}", target.name(), e.getMessage());
        }
        return snapshot;
    }

    /**
     * Reapply a snapshot taken by {@link #snapshot(Endpoint)}.
     */
    public RestoreOutcome restore(Endpoint target, TargetStateSnapshot snapshot, ShutdownSignal signal) {
        if (snapshot == null || snapshot.isEmpty()) {
            log.info("[TargetStateManager] No device state to restore for '{}'", target.name());
            return RestoreOutcome.NOTHING_TO_RESTORE;
        }

        int waited = 0;
        while (!target.isReady() && waited < readyAttempts) {
            log.debug("[TargetStateManager] Waiting for '{}' to reconnect...", target.name());
            if (signal.await(readyPollInterval)) {
                log.info("[TargetStateManager] Shutdown requested, '{}' state not restored", target.name());
                return RestoreOutcome.CANCELLED;
            }
            waited++;
        }
        if (!target.isReady()) {
            log.error("[TargetStateManager] '{}' did not reconnect in time, state not restored", target.name());
            return RestoreOutcome.TIMED_OUT;
        }

        try {
            target.stopApp();
        } catch (RuntimeException e) {
            log.error("[TargetStateManager] '{}' failed to quit app: {}", target.name(), e.getMessage());
        }
        try {
            if (snapshot.volumeLevel() != null) {
                target.setVolume(snapshot.volumeLevel());
            }
            if (snapshot.muted() != null) {
                target.setMuted(snapshot.muted());
            }
        } catch (RuntimeException e) {
            log.error("[TargetStateManager] '{}' failed to restore volume: {}", target.name(), e.getMessage());
        }
        return RestoreOutcome.RESTORED;
    }

    private static TargetStateSnapshot capture(Endpoint target) {
        EndpointStatus status = target.status();
        PlaybackStatus media = target.mediaSession() == null ? null : target.mediaSession().status();
        if (status == null && media == null) {
            return TargetStateSnapshot.EMPTY;
        }
        return new TargetStateSnapshot(
            status == null ? null : status.volumeLevel(),
            status == null ? null : status.muted(),
            status == null ? null : status.appId(),
            media == null ? null : media.supportsSeek());
    }
}
