package io.voicecast.application.service;

import io.voicecast.domain.model.AudioAsset;
import io.voicecast.domain.model.PlaybackResult;
import io.voicecast.domain.model.PlaybackStatus;
import io.voicecast.domain.model.PlayerState;
import io.voicecast.support.ScriptedMediaSession;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static io.voicecast.support.ScriptedMediaSession.playing;
import static io.voicecast.support.ScriptedMediaSession.status;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - IDLE only counts as completion after PLAYING/PAUSED
 * - Initial deadline bounds a player that never goes idle
 * - Reported duration moves the deadline once
 * - Shutdown cancels every wait
 */
class PlaybackCompletionDetectorTest {

    private static final String URL = "http://10.0.0.5:15555/abc.mp3?t=1";

    // 1000 bytes at 64 kbit/s is ~0.125s, so the 300ms minimum deadline applies.
    private final AudioAsset asset = new AudioAsset(Path.of("abc.mp3"), 1000, 0.125);

    static DetectorSettings fastSettings() {
        return new DetectorSettings(
            64_000,
            Duration.ofMillis(200),
            Duration.ofMillis(10),
            Duration.ofMillis(10),
            Duration.ofMillis(10),
            Duration.ofMillis(300),
            Duration.ZERO,
            Duration.ofMillis(100),
            Duration.ofMillis(10));
    }

    private final PlaybackCompletionDetector detector = new PlaybackCompletionDetector(fastSettings());

    @Test
    void playingThenIdleCompletes() {
        ScriptedMediaSession session = new ScriptedMediaSession(
            status(PlayerState.BUFFERING), playing(null, null), playing(3.0, 1.0), status(PlayerState.IDLE));

        PlaybackResult result = detector.play(session, URL, asset, new ShutdownSignal());

        assertTrue(result.completed());
        assertTrue(result.sawPlaying());
        assertFalse(result.cancelled());
        assertEquals(1, session.playedUrls().size());
        assertEquals(URL, session.playedUrls().get(0));
    }

    @Test
    void pausedCountsAsStarted() {
        ScriptedMediaSession session = new ScriptedMediaSession(
            status(PlayerState.PAUSED), status(PlayerState.IDLE));

        assertTrue(detector.play(session, URL, asset, new ShutdownSignal()).completed());
    }

    @Test
    void idleBeforePlayingIsNotCompletion() {
        ScriptedMediaSession session = new ScriptedMediaSession(status(PlayerState.IDLE));

        PlaybackResult result = detector.play(session, URL, asset, new ShutdownSignal());

        assertFalse(result.completed(), "IDLE without a prior PLAYING must not complete the session");
        assertFalse(result.sawPlaying());
        assertFalse(result.cancelled());
        assertTrue(result.elapsed().toMillis() >= 300, "Should wait out the deadline, took " + result.elapsed());
    }

    @Test
    void neverIdleEndsAtDeadline() {
        ScriptedMediaSession session = new ScriptedMediaSession(playing(null, null));

        PlaybackResult result = detector.play(session, URL, asset, new ShutdownSignal());

        assertFalse(result.completed());
        assertTrue(result.sawPlaying());
        assertTrue(result.elapsed().toMillis() < 5000, "Deadline not enforced: " + result.elapsed());
    }

    @Test
    void reportedDurationExtendsDeadline() {
        PlaybackStatus[] script = new PlaybackStatus[41];
        for (int i = 0; i < 40; i++) {
            script[i] = playing(2.0, i * 0.05);
        }
        script[40] = status(PlayerState.IDLE);
        ScriptedMediaSession session = new ScriptedMediaSession(script);

        PlaybackResult result = detector.play(session, URL, asset, new ShutdownSignal());

        assertTrue(result.completed(), "Duration-based deadline should outlast the 300ms initial one");
        assertTrue(session.refreshCount() >= 41);
    }

    @Test
    void statusRefreshFailureIsTolerated() {
        ScriptedMediaSession session = new ScriptedMediaSession(playing(null, null), status(PlayerState.IDLE))
            .failNextRefresh(new IllegalStateException("connection reset"));

        assertTrue(detector.play(session, URL, asset, new ShutdownSignal()).completed());
    }

    @Test
    void inactiveSessionStillPolledAfterActiveTimeout() {
        ScriptedMediaSession session = new ScriptedMediaSession(playing(null, null), status(PlayerState.IDLE))
            .withActive(false);

        PlaybackResult result = detector.play(session, URL, asset, new ShutdownSignal());

        assertTrue(result.completed());
        assertTrue(result.elapsed().toMillis() >= 200, "Should have waited for the active timeout");
    }

    @Test
    void shutdownCancelsPolling() throws InterruptedException {
        PlaybackCompletionDetector slow = new PlaybackCompletionDetector(
            fastSettings().withDeadlines(Duration.ofSeconds(30), Duration.ZERO, Duration.ofSeconds(30)));
        ScriptedMediaSession session = new ScriptedMediaSession(playing(null, null));
        ShutdownSignal signal = new ShutdownSignal();

        Thread trigger = new Thread(() -> {
            try {
                session.playedLatch().await();
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.trigger();
        });
        trigger.start();

        PlaybackResult result = slow.play(session, URL, asset, signal);
        trigger.join(1000);

        assertTrue(result.cancelled());
        assertFalse(result.completed());
        assertTrue(result.elapsed().toMillis() < 5000, "Shutdown should end the wait early: " + result.elapsed());
    }

    @Test
    void alreadyTriggeredSignalReturnsCancelled() {
        ScriptedMediaSession session = new ScriptedMediaSession(playing(null, null));
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();

        PlaybackResult result = detector.play(session, URL, asset, signal);

        assertTrue(result.cancelled());
        assertEquals(0, session.refreshCount());
    }
}
