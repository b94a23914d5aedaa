package io.voicecast.application.service;

import io.voicecast.application.port.output.MediaSession;
import io.voicecast.domain.model.AudioAsset;
import io.voicecast.domain.model.PlaybackResult;
import io.voicecast.domain.model.PlaybackStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Starts playback on a target and decides when it has really finished.
 *
 * Receivers report IDLE while buffering right after a play command, and only learn the media
 * duration once streaming starts. Raw idle detection therefore ends sessions too early. The
 * detector only accepts IDLE as completion after it has seen PLAYING or PAUSED, and bounds the
 * whole wait with a deadline that starts from a size-based estimate and is moved once when the
 * receiver reports the real duration.
 *
 * Every wait goes through the {@link ShutdownSignal}; a shutdown ends the session early with
 * {@code cancelled=true}.
 */
public final class PlaybackCompletionDetector {
    private static final Logger log = LoggerFactory.getLogger(PlaybackCompletionDetector.class);

    public static final String AUDIO_MPEG = "audio/mpeg";

    private final DetectorSettings settings;

    public PlaybackCompletionDetector(DetectorSettings settings) {
        this.settings = settings;
    }

    /**
     * Play {@code url} on {@code session} and block until playback completes, times out or
     * shutdown is requested.
     */
    public PlaybackResult play(MediaSession session, String url, AudioAsset asset, ShutdownSignal signal) {
        long startedAt = System.nanoTime();
        double estimated = AudioAsset.estimateSeconds(asset.sizeBytes(), settings.estimateBitrateBps());
        log.debug("[Detector] Playing {} ({} bytes, ~{}s)", url, asset.sizeBytes(), String.format("%.1f", estimated));

        session.play(url, AUDIO_MPEG);

        if (awaitActive(session, signal) || signal.await(settings.settle())) {
            return cancelled(false, false, startedAt);
        }

        boolean sawPlaying = false;
        boolean durationSet = false;
        boolean completed = false;
        boolean cancelled = false;
        long deadline = System.nanoTime() + settings.initialDeadline(estimated).toNanos();

        while (System.nanoTime() - deadline < 0) {
            if (signal.await(settings.pollInterval())) {
                cancelled = true;
                break;
            }

            PlaybackStatus status = refresh(session);
            if (status == null) {
                continue;
            }

            if (status.isPlaying() || status.isPaused()) {
                sawPlaying = true;
            }
            if (sawPlaying && !durationSet && status.isDurationKnown()) {
                deadline = System.nanoTime() + secondsToNanos(status.duration()) + settings.durationPadding().toNanos();
                durationSet = true;
            }
            if (sawPlaying && status.isIdle()) {
                completed = true;
                break;
            }

            if (log.isDebugEnabled()) {
                logProgress(status, sawPlaying, deadline);
            }
        }

        if (!cancelled && !signal.isTriggered()) {
            cancelled = signal.await(settings.flushGrace());
        } else {
            cancelled = true;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        return new PlaybackResult(completed, sawPlaying, cancelled, elapsed);
    }

    /**
     * @return true if shutdown was requested while waiting
     */
    private boolean awaitActive(MediaSession session, ShutdownSignal signal) {
        long limit = System.nanoTime() + settings.activeTimeout().toNanos();
        while (!isActive(session)) {
            long remaining = limit - System.nanoTime();
            if (remaining <= 0) {
                log.warn("[Detector] Media session not active after {}s, polling anyway",
                    settings.activeTimeout().toSeconds());
                return false;
            }
            Duration step = Duration.ofNanos(Math.min(remaining, settings.activePollInterval().toNanos()));
            if (signal.await(step)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isActive(MediaSession session) {
        try {
            return session.isActive();
        } catch (RuntimeException e) {
            log.debug("[Detector] isActive failed: {}", e.getMessage());
            return false;
        }
    }

    private static PlaybackStatus refresh(MediaSession session) {
        try {
            session.refreshStatus();
            return session.status();
        } catch (RuntimeException e) {
            log.warn("[Detector] Status refresh failed: {}", e.getMessage());
            return null;
        }
    }

    private static void logProgress(PlaybackStatus status, boolean sawPlaying, long deadline) {
        double remaining = (deadline - System.nanoTime()) / 1e9;
        if (!sawPlaying) {
            log.debug("[Detector] Waiting for player to start (timeout in {}s)", String.format("%.1f", remaining));
        } else if (status.positionPercent().isPresent()) {
            log.debug("[Detector] Playing ({}% of {}s, timeout in {}s)",
                status.positionPercent().getAsInt(), status.duration(), String.format("%.1f", remaining));
        } else {
            log.debug("[Detector] Playing (unknown position, timeout in {}s)", String.format("%.1f", remaining));
        }
    }

    private static PlaybackResult cancelled(boolean completed, boolean sawPlaying, long startedAt) {
        return new PlaybackResult(completed, sawPlaying, true, Duration.ofNanos(System.nanoTime() - startedAt));
    }

    private static long secondsToNanos(double seconds) {
        return (long) (seconds * 1_000_000_000L);
    }
}
