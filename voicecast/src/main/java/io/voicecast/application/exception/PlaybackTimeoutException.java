package io.voicecast.application.exception;

import io.voicecast.domain.model.SessionOutcome;

import java.nio.file.Path;

/**
 * Playback never produced a confirmed idle transition before the deadline.
 * The asset is kept on disk for inspection.
 */
public class PlaybackTimeoutException extends NotificationException {

    private final Path assetPath;

    public PlaybackTimeoutException(String target, Path assetPath, boolean sawPlaying) {
        super(target, sawPlaying
            ? "notification timed out before playback finished, asset kept at " + assetPath
            : "notification timed out, player never started, asset kept at " + assetPath);
        this.assetPath = assetPath;
    }

    public Path getAssetPath() {
        return assetPath;
    }

    @Override
    public SessionOutcome outcome() {
        return SessionOutcome.PLAYBACK_TIMEOUT;
    }
}
