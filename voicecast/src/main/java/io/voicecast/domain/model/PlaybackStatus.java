package io.voicecast.domain.model;

import java.util.OptionalInt;

/**
 * One observation of a media session. Re-read on every poll; never stored.
 *
 * @param state        reported transport state
 * @param duration     media length in seconds, null until the player knows it
 * @param currentTime  position in seconds, null when not reported
 * @param supportsSeek whether the loaded media accepts seek commands
 */
public record PlaybackStatus(PlayerState state, Double duration, Double currentTime, boolean supportsSeek) {

    public PlaybackStatus {
        state = state == null ? PlayerState.UNKNOWN : state;
    }

    public boolean isPlaying() {
        return state == PlayerState.PLAYING;
    }

    public boolean isPaused() {
        return state == PlayerState.PAUSED;
    }

    public boolean isIdle() {
        return state == PlayerState.IDLE;
    }

    public boolean isDurationKnown() {
        return duration != null;
    }

    /**
     * Position as a whole percentage of the duration.
     * Empty when either value is missing or the duration is not positive.
     */
    public OptionalInt positionPercent() {
        if (duration == null || currentTime == null || !(duration > 0)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (currentTime / duration * 100));
    }
}
