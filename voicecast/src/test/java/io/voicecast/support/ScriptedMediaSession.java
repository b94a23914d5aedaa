package io.voicecast.support;

import io.voicecast.application.port.output.MediaSession;
import io.voicecast.domain.model.PlaybackStatus;
import io.voicecast.domain.model.PlayerState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

/**
 * Media session that answers each status refresh with the next scripted status.
 * The last status repeats once the script is exhausted.
 */
public class ScriptedMediaSession implements MediaSession {

    private final List<PlaybackStatus> script;
    private final List<String> playedUrls = new ArrayList<>();
    private final CountDownLatch played = new CountDownLatch(1);

    private volatile boolean active = true;
    private volatile PlaybackStatus current;
    private volatile RuntimeException refreshFailure;
    private volatile Consumer<String> onPlay = url -> {};
    private volatile RuntimeException playFailure;
    private int index = -1;
    private int refreshCount;

    public ScriptedMediaSession(PlaybackStatus... script) {
        if (script.length == 0) {
            throw new IllegalArgumentException("empty script");
        }
        this.script = Arrays.asList(script);
    }

    public static PlaybackStatus status(PlayerState state) {
        return new PlaybackStatus(state, null, null, true);
    }

    public static PlaybackStatus playing(Double duration, Double currentTime) {
        return new PlaybackStatus(PlayerState.PLAYING, duration, currentTime, true);
    }

    public ScriptedMediaSession withActive(boolean active) {
        this.active = active;
        return this;
    }

    /** Fail the next refresh once with {@code failure}. */
    public ScriptedMediaSession failNextRefresh(RuntimeException failure) {
        this.refreshFailure = failure;
        return this;
    }

    public ScriptedMediaSession onPlay(Consumer<String> onPlay) {
        this.onPlay = onPlay;
        return this;
    }

    /** Make every {@link #play} call throw {@code failure}. */
    public ScriptedMediaSession failPlay(RuntimeException failure) {
        this.playFailure = failure;
        return this;
    }

    public synchronized List<String> playedUrls() {
        return new ArrayList<>(playedUrls);
    }

    public synchronized int refreshCount() {
        return refreshCount;
    }

    public CountDownLatch playedLatch() {
        return played;
    }

    @Override
    public void play(String url, String contentType) {
        synchronized (this) {
            playedUrls.add(url);
        }
        RuntimeException failure = playFailure;
        if (failure != null) {
            throw failure;
        }
        onPlay.accept(url);
        played.countDown();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public synchronized void refreshStatus() {
        refreshCount++;
        RuntimeException failure = refreshFailure;
        if (failure != null) {
            refreshFailure = null;
            throw failure;
        }
        if (index < script.size() - 1) {
            index++;
        }
        current = script.get(index);
    }

    @Override
    public PlaybackStatus status() {
        return current;
    }

    @Override
    public void seek(double positionSeconds) {
    }
}
